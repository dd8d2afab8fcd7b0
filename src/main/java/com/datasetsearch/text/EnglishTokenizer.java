package com.datasetsearch.text;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class EnglishTokenizer implements Tokenizer {

    private static final Pattern WORD_PATTERN = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final boolean enableStopWords;

    /**
     * 创建英文分词器。
     */
    public EnglishTokenizer(boolean enableStopWords) {
        this.enableStopWords = enableStopWords;
    }

    /**
     * 对文本分词并一次性返回全部词项。
     */
    @Override
    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        iterate(text).forEachRemaining(tokens::add);
        return List.copyOf(tokens);
    }

    /**
     * 惰性切分：每次调用都返回一个新的迭代器，只在推进时才匹配下一个词。
     */
    public Iterator<Token> iterate(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyIterator();
        }
        return new TokenIterator(WORD_PATTERN.matcher(normalize(text)));
    }

    /**
     * 折叠重音符号并转为小写。
     */
    static String normalize(String text) {
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private final class TokenIterator implements Iterator<Token> {
        private final Matcher matcher;
        private Token pending;
        private int nextPosition;

        private TokenIterator(Matcher matcher) {
            this.matcher = matcher;
        }

        @Override
        public boolean hasNext() {
            while (pending == null && matcher.find()) {
                String term = matcher.group();
                if (enableStopWords && StopWords.isStopWord(term)) {
                    continue;
                }
                pending = new Token(term, nextPosition++);
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
    }
}
