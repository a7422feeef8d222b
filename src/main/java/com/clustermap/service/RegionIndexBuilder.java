package com.clustermap.service;

import com.clustermap.exceptions.PipelineStageException;
import com.clustermap.model.BinningParameters;
import com.clustermap.model.MergeEvent;
import com.clustermap.model.Pixel;
import com.clustermap.model.PipelineStage;
import com.clustermap.model.PixelGrid;
import com.clustermap.model.Region;
import com.clustermap.model.RegionIndexMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Adaptive circular binning. Seeds sit on a regular lattice and each one grows a circle
 * until the unclaimed pixels inside it reach the target signal-to-noise. Seeds are
 * processed row-major, so earlier regions win overlaps and the result tiles the image
 * without double counting: small bins in bright cores, large ones in faint outskirts.
 */
public class RegionIndexBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RegionIndexBuilder.class);

    private static final int UNCLAIMED = 0;

    private final PipelineListener listener;

    public RegionIndexBuilder() {
        this(PipelineListener.NONE);
    }

    public RegionIndexBuilder(PipelineListener listener) {
        this.listener = listener != null ? listener : PipelineListener.NONE;
    }

    public RegionIndexMap build(PixelGrid grid, BinningParameters params) throws PipelineStageException {
        if (grid == null || params == null) throw new IllegalArgumentException("Pixel grid and parameters are required");
        int w = grid.width(), h = grid.height();

        int[][] owner = new int[h][w];
        int included = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                float e = grid.exposureAt(x, y);
                if (!Float.isFinite(e) || e <= params.exposureFloor) {
                    owner[y][x] = RegionIndexMap.EXCLUDED;
                } else {
                    included++;
                }
            }
        }
        if (included == 0) {
            throw new PipelineStageException(PipelineStage.CREATE_BINS, String.format(
                    "empty region set: no pixel has exposure above the floor %.3g", params.exposureFloor));
        }
        logger.info("Binning {}x{} image ({} usable pixels) to S/N {} at {} resolution",
                w, h, included, params.signalToNoise, params.resolution);

        List<int[]> offsets = circleOffsets(params.maxRadius);
        List<Growing> frozen = new ArrayList<>();
        List<Orphan> orphans = new ArrayList<>();

        int cell = params.resolution.cellSize();
        for (int y0 = 0; y0 < h; y0 += cell) {
            for (int x0 = 0; x0 < w; x0 += cell) {
                int cx = Math.min(x0 + cell / 2, w - 1);
                int cy = Math.min(y0 + cell / 2, h - 1);
                if (owner[cy][cx] != UNCLAIMED) continue;
                grow(grid, params, owner, offsets, cx, cy, frozen, orphans);
            }
        }

        if (frozen.isEmpty()) {
            throw new PipelineStageException(PipelineStage.CREATE_BINS, String.format(
                    "S/N target %d is unreachable below radius %.1f: no region could be frozen",
                    params.signalToNoise, params.maxRadius));
        }

        List<MergeEvent> merges = new ArrayList<>();
        for (Orphan orphan : orphans) {
            Growing target = nearest(frozen, orphan.seedX, orphan.seedY);
            int absorbed = 0;
            for (Pixel p : orphan.candidates) {
                if (owner[p.y][p.x] == UNCLAIMED) {
                    owner[p.y][p.x] = target.id;
                    absorbed++;
                }
            }
            target.pixelCount += absorbed;
            target.absorbed += absorbed;
            double dist = Math.sqrt(sq(orphan.seedX - target.cx) + sq(orphan.seedY - target.cy));
            MergeEvent merge = new MergeEvent(new Pixel(orphan.seedX, orphan.seedY), target.id, absorbed, dist, orphan.sn);
            merges.add(merge);
            logger.warn("Seed ({},{}) reached only S/N {} within radius {}; merged {} pixels into region {}",
                    orphan.seedX, orphan.seedY, String.format("%.2f", orphan.sn), params.maxRadius, absorbed, target.id);
            listener.regionMerged(merge);
        }

        int leftovers = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (owner[y][x] != UNCLAIMED) continue;
                Growing target = nearest(frozen, x, y);
                owner[y][x] = target.id;
                target.pixelCount++;
                target.absorbed++;
                leftovers++;
            }
        }
        if (leftovers > 0) logger.debug("Assigned {} leftover pixels to their nearest region", leftovers);

        List<Region> regions = new ArrayList<>(frozen.size());
        for (Growing g : frozen) regions.add(g.toRegion());
        logger.info("Created {} regions ({} orphan seeds merged)", regions.size(), merges.size());
        return new RegionIndexMap(owner, regions, merges);
    }

    private void grow(PixelGrid grid, BinningParameters params, int[][] owner, List<int[]> offsets,
                      int cx, int cy, List<Growing> frozen, List<Orphan> orphans) {
        int w = grid.width(), h = grid.height();
        double target = params.signalToNoise;
        double counts = 0;
        int npix = 0;
        double sn = 0;
        List<Pixel> members = new ArrayList<>();
        List<Double> trace = new ArrayList<>();
        int next = 0;

        for (int k = 0; ; k++) {
            double r = k * params.radiusStep;
            if (r > params.maxRadius) break;
            double r2 = r * r;
            while (next < offsets.size() && offsets.get(next)[2] <= r2) {
                int[] o = offsets.get(next++);
                int x = cx + o[0], y = cy + o[1];
                if (x < 0 || y < 0 || x >= w || y >= h || owner[y][x] != UNCLAIMED) continue;
                counts += grid.countsAt(x, y);
                npix++;
                members.add(new Pixel(x, y));
            }
            sn = SignalToNoise.of(counts, params.backgroundPerPixel * npix);
            trace.add(sn);
            if (sn >= target) {
                Growing g = new Growing(frozen.size() + 1, cx, cy, r, sn, npix, trace);
                for (Pixel p : members) owner[p.y][p.x] = g.id;
                frozen.add(g);
                return;
            }
            if (next >= offsets.size()) break;
        }
        orphans.add(new Orphan(cx, cy, sn, members));
    }

    /** Lowest id wins ties: regions are scanned in id order and only a strictly closer one replaces the best. */
    private static Growing nearest(List<Growing> frozen, int x, int y) {
        Growing best = null;
        long bestD = Long.MAX_VALUE;
        for (Growing g : frozen) {
            long d = sq(x - g.cx) + sq(y - g.cy);
            if (d < bestD) {
                bestD = d;
                best = g;
            }
        }
        return best;
    }

    /** Offsets {dx, dy, dx^2+dy^2} within the ceiling, nearest first, row-major within a ring. */
    static List<int[]> circleOffsets(double maxRadius) {
        int rMax = (int) Math.floor(maxRadius);
        double limit = maxRadius * maxRadius;
        List<int[]> offsets = new ArrayList<>();
        for (int dy = -rMax; dy <= rMax; dy++) {
            for (int dx = -rMax; dx <= rMax; dx++) {
                int d2 = dx * dx + dy * dy;
                if (d2 <= limit) offsets.add(new int[]{dx, dy, d2});
            }
        }
        offsets.sort(Comparator.<int[]>comparingInt(o -> o[2]).thenComparingInt(o -> o[1]).thenComparingInt(o -> o[0]));
        return offsets;
    }

    private static long sq(long v) { return v * v; }

    private static class Growing {
        final int id, cx, cy;
        final double radius, sn;
        final double[] trace;
        int pixelCount, absorbed;

        Growing(int id, int cx, int cy, double radius, double sn, int pixelCount, List<Double> trace) {
            this.id = id; this.cx = cx; this.cy = cy;
            this.radius = radius; this.sn = sn; this.pixelCount = pixelCount;
            this.trace = trace.stream().mapToDouble(Double::doubleValue).toArray();
        }

        Region toRegion() {
            return new Region(id, cx, cy, radius, sn, pixelCount, absorbed, trace);
        }
    }

    private static class Orphan {
        final int seedX, seedY;
        final double sn;
        final List<Pixel> candidates;

        Orphan(int seedX, int seedY, double sn, List<Pixel> candidates) {
            this.seedX = seedX; this.seedY = seedY; this.sn = sn; this.candidates = candidates;
        }
    }
}
