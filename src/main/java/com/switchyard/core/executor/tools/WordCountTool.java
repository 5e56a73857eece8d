package com.switchyard.core.executor.tools;

import com.switchyard.core.executor.LocalTool;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Word frequencies: lower-cased, punctuation stripped, top 20 by count.
 */
@Component
public class WordCountTool implements LocalTool {

    static final int TOP_WORDS = 20;
    private static final Pattern PUNCTUATION = Pattern.compile("[^a-z0-9\\s]");

    @Override
    public String name() {
        return "count_words";
    }

    @Override
    public Object execute(Map<String, Object> parameters) {
        String text = TextParameters.requireText(parameters);
        String normalized = PUNCTUATION.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");

        var counts = new HashMap<String, Integer>();
        String[] words = TextParameters.words(normalized);
        for (String word : words) {
            counts.merge(word, 1, Integer::sum);
        }

        var top = new LinkedHashMap<String, Integer>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_WORDS)
                .forEach(e -> top.put(e.getKey(), e.getValue()));

        var result = new LinkedHashMap<String, Object>();
        result.put("total_words", words.length);
        result.put("unique_words", counts.size());
        result.put("word_counts", top);
        return result;
    }
}
