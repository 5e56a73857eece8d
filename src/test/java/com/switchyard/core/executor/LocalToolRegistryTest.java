package com.switchyard.core.executor;

import com.switchyard.core.executor.tools.ReadingTimeTool;
import com.switchyard.core.executor.tools.WordCountTool;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LocalToolRegistryTest {

    private static LocalTool named(String name) {
        return new LocalTool() {
            @Override public String name() { return name; }
            @Override public Object execute(Map<String, Object> parameters) { return name; }
        };
    }

    @Test
    void registersBuiltInTools() {
        var registry = new LocalToolRegistry(List.of(new WordCountTool(), new ReadingTimeTool()));

        assertEquals(List.of("calculate_reading_time", "count_words"), registry.names());
        assertTrue(registry.contains("count_words"));
        assertTrue(registry.lookup("calculate_reading_time").isPresent());
        assertTrue(registry.lookup("build_graph").isEmpty());
    }

    @Test
    void rejectsInvalidName() {
        assertThrows(IllegalStateException.class, () -> new LocalToolRegistry(List.of(named("bad name"))));
        assertThrows(IllegalStateException.class, () -> new LocalToolRegistry(List.of(named(null))));
    }

    @Test
    void rejectsCaseInsensitiveDuplicate() {
        var e = assertThrows(IllegalStateException.class,
                () -> new LocalToolRegistry(List.of(named("Echo"), named("echo"))));
        assertTrue(e.getMessage().contains("Echo"));
    }
}
