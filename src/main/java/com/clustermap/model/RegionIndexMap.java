package com.clustermap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pixel-to-region assignment produced by the adaptive binning, plus the region catalogue
 * and the scale map derived from it. Immutable: every accessor returns a copy.
 */
public class RegionIndexMap {

    /** Id of pixels below the exposure floor. Never assigned to a region. */
    public static final int EXCLUDED = -1;

    private final int[][] ids;
    private final int width;
    private final int height;
    private final Map<Integer, Region> regions;
    private final List<MergeEvent> merges;
    private final Map<Integer, List<Pixel>> members;

    public RegionIndexMap(int[][] ids, List<Region> regions, List<MergeEvent> merges) {
        if (ids == null || ids.length == 0 || ids[0].length == 0) {
            throw new IllegalArgumentException("Region index map is empty");
        }
        this.height = ids.length;
        this.width = ids[0].length;
        this.ids = PixelGrid.copy(ids);

        Map<Integer, Region> byId = new LinkedHashMap<>();
        regions.stream()
                .sorted((a, b) -> Integer.compare(a.id, b.id))
                .forEach(r -> byId.put(r.id, r));
        this.regions = Collections.unmodifiableMap(byId);
        this.merges = List.copyOf(merges);

        Map<Integer, List<Pixel>> m = new LinkedHashMap<>();
        for (Integer id : byId.keySet()) m.put(id, new ArrayList<>());
        for (int y = 0; y < height; y++) {
            if (this.ids[y].length != width) throw new IllegalArgumentException("Ragged region index map at row " + y);
            for (int x = 0; x < width; x++) {
                int id = this.ids[y][x];
                if (id == EXCLUDED) continue;
                List<Pixel> list = m.get(id);
                if (list == null) {
                    throw new IllegalArgumentException(String.format("Pixel (%d,%d) owned by unknown region %d", x, y, id));
                }
                list.add(new Pixel(x, y));
            }
        }
        m.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.members = Collections.unmodifiableMap(m);
    }

    public int width() { return width; }
    public int height() { return height; }

    public int regionAt(int x, int y) { return ids[y][x]; }

    public boolean isExcluded(int x, int y) { return ids[y][x] == EXCLUDED; }

    public int[][] ids() { return PixelGrid.copy(ids); }

    public int regionCount() { return regions.size(); }

    /** Regions ordered by id. */
    public List<Region> regions() { return new ArrayList<>(regions.values()); }

    public Region region(int id) {
        Region r = regions.get(id);
        if (r == null) throw new IllegalArgumentException("Unknown region " + id);
        return r;
    }

    public List<Pixel> pixelsOf(int id) {
        List<Pixel> p = members.get(id);
        if (p == null) throw new IllegalArgumentException("Unknown region " + id);
        return p;
    }

    public List<MergeEvent> merges() { return merges; }

    public int assignedPixelCount() {
        int n = 0;
        for (List<Pixel> p : members.values()) n += p.size();
        return n;
    }

    /** Radius of the owning region for every pixel; NaN where excluded. */
    public float[][] scaleMap() {
        float[][] scale = new float[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int id = ids[y][x];
                scale[y][x] = id == EXCLUDED ? Float.NaN : (float) regions.get(id).radius;
            }
        }
        return scale;
    }

    public boolean sameShape(float[][] other) {
        if (other == null || other.length != height) return false;
        for (float[] row : other) {
            if (row.length != width) return false;
        }
        return true;
    }
}
