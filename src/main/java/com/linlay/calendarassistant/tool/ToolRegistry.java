package com.linlay.calendarassistant.tool;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ToolRegistry {

    private final Map<CalendarToolName, CalendarTool> toolsByName;

    public ToolRegistry(List<CalendarTool> tools) {
        Map<CalendarToolName, CalendarTool> byName = new EnumMap<>(CalendarToolName.class);
        for (CalendarTool tool : tools) {
            CalendarTool previous = byName.put(tool.name(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate calendar tool: " + tool.name().wireName());
            }
        }
        this.toolsByName = Map.copyOf(byName);
    }

    public Optional<CalendarTool> find(String wireName) {
        return CalendarToolName.fromWireName(wireName).map(toolsByName::get);
    }
}
