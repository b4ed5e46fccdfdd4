package org.buaa.datastd.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 数据标准服务配置
 */
@Component
@ConfigurationProperties(prefix = "datastd")
@Data
public class DataStandardProperties {

    private Vector vector = new Vector();
    private Search search = new Search();
    private Tokenizer tokenizer = new Tokenizer();
    private Sync sync = new Sync();
    private Page page = new Page();

    @Data
    public static class Vector {
        private String wordRootIndex = "word_roots";
        private String standardFieldIndex = "standard_fields";
        private int dimension = 384;
    }

    @Data
    public static class Search {
        /**
         * 字面检索返回上限
         */
        private int lexicalLimit = 10;
        /**
         * 语义检索返回条数
         */
        private int semanticTopK = 5;
        private int numCandidates = 50;
    }

    @Data
    public static class Tokenizer {
        /**
         * 词根写入分词词典时使用的词频，足够大以保证不被再次切分
         */
        private int learnedFrequency = 99999;
        private String nature = "nz";
    }

    @Data
    public static class Sync {
        private boolean resyncOnStartup = true;
    }

    @Data
    public static class Page {
        private int defaultSize = 20;
        private int maxSize = 200;
    }
}
