package com.datasetsearch.text;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * 词干化后的词项序列，每次 iterator() 都从头重新切分。
 */
public final class TermSequence implements Iterable<String> {
    private final Supplier<Iterator<String>> iteratorFactory;

    TermSequence(Supplier<Iterator<String>> iteratorFactory) {
        this.iteratorFactory = iteratorFactory;
    }

    @Override
    public Iterator<String> iterator() {
        return iteratorFactory.get();
    }

    public boolean isEmpty() {
        return !iterator().hasNext();
    }

    public List<String> toList() {
        List<String> terms = new ArrayList<>();
        iterator().forEachRemaining(terms::add);
        return terms;
    }
}
