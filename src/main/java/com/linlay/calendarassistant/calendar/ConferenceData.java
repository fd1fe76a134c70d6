package com.linlay.calendarassistant.calendar;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConferenceData(List<EntryPoint> entryPoints) {

    public Optional<String> videoUri() {
        if (entryPoints == null) {
            return Optional.empty();
        }
        return entryPoints.stream()
                .filter(entryPoint -> entryPoint != null && "video".equals(entryPoint.entryPointType()))
                .map(EntryPoint::uri)
                .filter(uri -> uri != null && !uri.isBlank())
                .findFirst();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EntryPoint(String entryPointType, String uri) {
    }
}
