package org.buaa.datastd.tool;

import com.hankcs.hanlp.dictionary.CustomDictionary;
import com.hankcs.hanlp.seg.common.Term;
import com.hankcs.hanlp.tokenizer.StandardTokenizer;
import org.buaa.datastd.config.DataStandardProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 共享分词状态
 *
 * <p>HanLP 的自定义词典是进程级可变状态。分词走读锁，可完全并发；
 * 写入词条走写锁，只覆盖词典修改本身。</p>
 */
@Component
public class TokenizerState {

    private static final Logger log = LoggerFactory.getLogger(TokenizerState.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final String natureWithFrequency;

    public TokenizerState(DataStandardProperties properties) {
        DataStandardProperties.Tokenizer config = properties.getTokenizer();
        this.natureWithFrequency = config.getNature() + " " + config.getLearnedFrequency();
    }

    /**
     * 精确模式分词
     *
     * @param text 待切分文本
     * @return 按出现顺序排列的非空词元
     */
    public List<String> segment(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Term> terms;
        lock.readLock().lock();
        try {
            terms = StandardTokenizer.segment(text);
        } finally {
            lock.readLock().unlock();
        }

        List<String> words = new ArrayList<>(terms.size());
        for (Term term : terms) {
            String word = term.word.trim();
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * 将词条以高词频写入自定义词典，保证其不再被切分
     */
    public void learn(String word) {
        if (word == null || word.isBlank()) {
            return;
        }
        lock.writeLock().lock();
        try {
            CustomDictionary.insert(word.trim(), natureWithFrequency);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 批量写入词条，启动预热使用
     *
     * @return 写入的词条数
     */
    public int learnAll(Collection<String> words) {
        int learned = 0;
        lock.writeLock().lock();
        try {
            for (String word : words) {
                if (word != null && !word.isBlank()) {
                    CustomDictionary.insert(word.trim(), natureWithFrequency);
                    learned++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("自定义词典加载完成，共计 {} 个词条", learned);
        return learned;
    }
}
