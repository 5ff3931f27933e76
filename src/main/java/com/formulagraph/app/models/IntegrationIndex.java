package com.formulagraph.app.models;

import java.util.*;

/**
 * Advisory mapping from a semantic parameter to candidate cells across documents.
 * Only parameters found in more than one location are integration points.
 */
public class IntegrationIndex {

    private final Map<IntegrationParameter, List<ParameterMatch>> points;

    public IntegrationIndex(Map<IntegrationParameter, List<ParameterMatch>> points) {
        Map<IntegrationParameter, List<ParameterMatch>> copy = new EnumMap<>(IntegrationParameter.class);
        points.forEach((parameter, matches) -> copy.put(parameter, Collections.unmodifiableList(new ArrayList<>(matches))));
        this.points = Collections.unmodifiableMap(copy);
    }

    public Map<IntegrationParameter, List<ParameterMatch>> getPoints() {
        return points;
    }

    public List<ParameterMatch> getMatches(IntegrationParameter parameter) {
        return points.getOrDefault(parameter, Collections.emptyList());
    }

    public Set<QualifiedAddress> getAddresses(IntegrationParameter parameter) {
        Set<QualifiedAddress> addresses = new LinkedHashSet<>();
        for (ParameterMatch match : getMatches(parameter)) {
            addresses.add(match.getAddress());
        }
        return addresses;
    }

    /**
     * Parameter phrase -> flat "doc#Sheet!A1" keys, the shape exported to reports.
     */
    public Map<String, List<String>> toFlatMap() {
        Map<String, List<String>> flat = new LinkedHashMap<>();
        for (Map.Entry<IntegrationParameter, List<ParameterMatch>> entry : points.entrySet()) {
            List<String> keys = new ArrayList<>();
            for (ParameterMatch match : entry.getValue()) {
                keys.add(match.getAddress().toString());
            }
            flat.put(entry.getKey().name().toLowerCase(Locale.ROOT), keys);
        }
        return flat;
    }
}
