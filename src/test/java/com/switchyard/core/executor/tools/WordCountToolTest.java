package com.switchyard.core.executor.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WordCountToolTest {

    private final WordCountTool tool = new WordCountTool();

    @SuppressWarnings("unchecked")
    private Map<String, Object> run(String text) {
        return (Map<String, Object>) tool.execute(Map.of("text", text));
    }

    @Test
    void countsCaseInsensitivelyWithoutPunctuation() {
        var result = run("The cat. the CAT, the dog!");

        assertEquals(6, result.get("total_words"));
        assertEquals(3, result.get("unique_words"));
        assertEquals(Map.of("the", 3, "cat", 2, "dog", 1), result.get("word_counts"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void ordersByCountThenWord() {
        var counts = (Map<String, Integer>) run("b a c b a b").get("word_counts");
        assertEquals(List.of("b", "a", "c"), List.copyOf(counts.keySet()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void keepsOnlyTopTwenty() {
        var text = new StringBuilder();
        for (int i = 0; i < 30; i++) {
            text.append("w").append(i).append(' ');
        }
        var result = run(text.toString());
        assertEquals(30, result.get("unique_words"));
        assertEquals(WordCountTool.TOP_WORDS, ((Map<String, Integer>) result.get("word_counts")).size());
    }

    @Test
    void emptyText() {
        var result = run("");
        assertEquals(0, result.get("total_words"));
        assertEquals(0, result.get("unique_words"));
    }
}
