package com.switchyard.core.executor.tools;

import com.switchyard.core.executor.LocalTool;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Estimates reading time at a fixed words-per-minute rate (200 unless {@code wpm} is given).
 * Non-empty text always takes at least one minute.
 */
@Component
public class ReadingTimeTool implements LocalTool {

    static final int DEFAULT_WPM = 200;

    @Override
    public String name() {
        return "calculate_reading_time";
    }

    @Override
    public Object execute(Map<String, Object> parameters) {
        String text = TextParameters.requireText(parameters);
        int wpm = TextParameters.optionalPositiveInt(parameters, "wpm", DEFAULT_WPM);

        int wordCount = TextParameters.words(text).length;
        int minutes = wordCount == 0 ? 0 : Math.max(1, (int) Math.ceil(wordCount / (double) wpm));

        var result = new LinkedHashMap<String, Object>();
        result.put("reading_time_minutes", minutes);
        result.put("word_count", wordCount);
        result.put("reading_speed_wpm", wpm);
        return result;
    }
}
