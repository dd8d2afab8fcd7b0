package com.datasetsearch.text;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TokenizerTest {

    @Test
    @DisplayName("EnglishTokenizer: 小写并按非字母数字切分")
    void testEnglishTokenizerSimple() {
        EnglishTokenizer tokenizer = new EnglishTokenizer(false);

        List<Token> tokens = tokenizer.tokenize("Hello, World! foo_bar 42");

        assertEquals(List.of("hello", "world", "foo", "bar", "42"), terms(tokens));
        assertEquals(0, tokens.get(0).position());
        assertEquals(4, tokens.get(4).position());
    }

    @Test
    @DisplayName("EnglishTokenizer: 折叠重音符号")
    void testEnglishTokenizerFoldsAccents() {
        EnglishTokenizer tokenizer = new EnglishTokenizer(false);

        assertEquals(List.of("cafe", "naive"), terms(tokenizer.tokenize("Café NAÏVE")));
    }

    @Test
    @DisplayName("EnglishTokenizer: 停用词过滤")
    void testEnglishTokenizerWithStopWords() {
        EnglishTokenizer tokenizer = new EnglishTokenizer(true);

        List<Token> tokens = tokenizer.tokenize("The quick brown fox");

        assertEquals(List.of("quick", "brown", "fox"), terms(tokens));
        assertEquals(0, tokens.get(0).position());
    }

    @Test
    @DisplayName("EnglishTokenizer: 空文本返回空结果")
    void testEnglishTokenizerEmpty() {
        EnglishTokenizer tokenizer = new EnglishTokenizer(false);

        assertTrue(tokenizer.tokenize("").isEmpty());
        assertTrue(tokenizer.tokenize(null).isEmpty());
        assertTrue(tokenizer.tokenize("?!... ---").isEmpty());
    }

    @Test
    @DisplayName("PorterStemmingTokenizer: 复数与动词形态归并到同一词干")
    void testPorterStemming() {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);

        assertEquals(List.of("the", "dog", "ran"), tokenizer.terms("The dog ran").toList());
        assertEquals(List.of("dog", "bark"), tokenizer.terms("dogs barking").toList());
        assertEquals(List.of("cat", "sleep"), tokenizer.terms("Cats sleep").toList());
    }

    @Test
    @DisplayName("PorterStemmingTokenizer: 默认不过滤停用词")
    void testStopWordsKeptByDefault() {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);

        assertEquals(List.of("the"), tokenizer.terms("the").toList());
        assertTrue(new PorterStemmingTokenizer(true).terms("the").isEmpty());
    }

    @Test
    @DisplayName("PorterStemmingTokenizer: 词项序列可重复遍历")
    void testTermSequenceRestartable() {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);
        TermSequence sequence = tokenizer.terms("running dogs");

        List<String> first = sequence.toList();
        List<String> second = sequence.toList();

        assertEquals(first, second);
        assertEquals(List.of("run", "dog"), first);
    }

    @Test
    @DisplayName("PorterStemmingTokenizer: 惰性迭代器逐个产出")
    void testLazyIterator() {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);
        Iterator<String> iterator = tokenizer.terms("alpha beta").iterator();

        assertTrue(iterator.hasNext());
        assertEquals("alpha", iterator.next());
        assertTrue(iterator.hasNext());
        assertEquals("beta", iterator.next());
        assertFalse(iterator.hasNext());
    }

    @ParameterizedTest
    @ValueSource(strings = {"dogs", "running", "connection", "searches"})
    @DisplayName("PorterStemmingTokenizer: 词干本身再分词仍得到同一词干")
    void testStemmedFormMatchesItself(String word) {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);
        String stem = tokenizer.terms(word).toList().get(0);

        assertEquals(stem, tokenizer.stem(stem));
    }

    @Test
    @DisplayName("PorterStemmingTokenizer: tokenize 位置连续")
    void testTokenizePositions() {
        PorterStemmingTokenizer tokenizer = new PorterStemmingTokenizer(false);

        List<Token> tokens = tokenizer.tokenize("Dogs, cats & birds");

        assertEquals(3, tokens.size());
        assertEquals(new Token("dog", 0), tokens.get(0));
        assertEquals(new Token("cat", 1), tokens.get(1));
        assertEquals(new Token("bird", 2), tokens.get(2));
    }

    private static List<String> terms(List<Token> tokens) {
        return tokens.stream().map(Token::term).toList();
    }
}
