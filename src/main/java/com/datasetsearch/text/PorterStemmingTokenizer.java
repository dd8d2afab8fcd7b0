package com.datasetsearch.text;

import opennlp.tools.stemmer.PorterStemmer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 在英文分词结果上做 Porter 词干化，建索引与查询共用同一实例，保证两端词项一致。
 *
 * 非英文文本也能处理，但词干规则只针对英语，召回效果会下降。
 */
public class PorterStemmingTokenizer implements Tokenizer {

    // PorterStemmer 内部有可变缓冲区，按线程复用
    private static final ThreadLocal<PorterStemmer> STEMMER_CACHE = ThreadLocal.withInitial(PorterStemmer::new);

    private final EnglishTokenizer englishTokenizer;

    public PorterStemmingTokenizer(boolean enableStopWords) {
        this.englishTokenizer = new EnglishTokenizer(enableStopWords);
    }

    @Override
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        Iterator<Token> iterator = stemmedIterator(text);
        iterator.forEachRemaining(tokens::add);
        return List.copyOf(tokens);
    }

    /**
     * 返回可重复遍历的惰性词项序列。
     */
    public TermSequence terms(String text) {
        return new TermSequence(() -> {
            Iterator<Token> tokens = stemmedIterator(text);
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return tokens.hasNext();
                }

                @Override
                public String next() {
                    return tokens.next().term();
                }
            };
        });
    }

    /**
     * 对单个已归一化的词做词干化。
     */
    public String stem(String word) {
        return STEMMER_CACHE.get().stem(word);
    }

    private Iterator<Token> stemmedIterator(String text) {
        Iterator<Token> rawTokens = englishTokenizer.iterate(text);
        return new Iterator<>() {
            private Token pending;
            private int nextPosition;

            @Override
            public boolean hasNext() {
                while (pending == null && rawTokens.hasNext()) {
                    String stemmed = stem(rawTokens.next().term());
                    if (stemmed != null && !stemmed.isEmpty()) {
                        pending = new Token(stemmed, nextPosition++);
                    }
                }
                return pending != null;
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Token token = pending;
                pending = null;
                return token;
            }
        };
    }
}
