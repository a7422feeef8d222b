package com.clustermap.model;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Exposure correction factor per region. Regions with no exposure in any observation are
 * listed as invalid and carry no factor; they are skipped by the fitting stage.
 */
public class ExposureCorrectionTable {

    private final Map<Integer, Double> factors;
    private final Set<Integer> invalid;

    public ExposureCorrectionTable(Map<Integer, Double> factors, Set<Integer> invalid) {
        for (Map.Entry<Integer, Double> e : factors.entrySet()) {
            if (!(e.getValue() > 0)) {
                throw new IllegalArgumentException("Correction factor of region " + e.getKey() + " must be > 0");
            }
            if (invalid.contains(e.getKey())) {
                throw new IllegalArgumentException("Region " + e.getKey() + " is both valid and invalid");
            }
        }
        this.factors = Collections.unmodifiableMap(new TreeMap<>(factors));
        this.invalid = Collections.unmodifiableSet(new TreeSet<>(invalid));
    }

    public boolean isValid(int regionId) { return factors.containsKey(regionId); }

    public OptionalDouble factor(int regionId) {
        Double f = factors.get(regionId);
        return f == null ? OptionalDouble.empty() : OptionalDouble.of(f);
    }

    public Map<Integer, Double> factors() { return factors; }

    public Set<Integer> invalidRegions() { return invalid; }
}
