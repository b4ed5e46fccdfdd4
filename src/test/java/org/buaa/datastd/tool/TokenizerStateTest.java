package org.buaa.datastd.tool;

import org.buaa.datastd.config.DataStandardProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class TokenizerStateTest {

    private TokenizerState tokenizerState;

    @BeforeEach
    void setUp() {
        tokenizerState = new TokenizerState(new DataStandardProperties());
    }

    @Test
    void learnedTermIsNotSplit() {
        String term = "客户联络偏好码";

        tokenizerState.learn(term);

        assertThat(tokenizerState.segment(term)).containsExactly(term);
    }

    @Test
    void blankTextYieldsNoTokens() {
        assertThat(tokenizerState.segment("   ")).isEmpty();
        assertThat(tokenizerState.segment(null)).isEmpty();
    }

    @Test
    void learnAllSkipsBlankEntries() {
        int learned = tokenizerState.learnAll(Arrays.asList("账户余额标识", " ", null, "交易流水编号"));

        assertThat(learned).isEqualTo(2);
        assertThat(tokenizerState.segment("交易流水编号")).containsExactly("交易流水编号");
    }
}
