package com.clustermap.service;

import com.clustermap.model.CoordinateReference;
import com.clustermap.model.PixelGrid;
import com.clustermap.model.SpatialMap;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;

/**
 * Reads input images and writes map products as 2-D FITS images in the primary HDU.
 * World coordinates travel through the CRPIX/CRVAL/CDELT/CTYPE cards.
 */
public class FitsImageService {

    private static final Logger logger = LoggerFactory.getLogger(FitsImageService.class);

    public PixelGrid readPixelGrid(File countsFile, File exposureFile) throws IOException {
        int[][] counts = readCounts(countsFile);
        float[][] exposure = readFloatImage(exposureFile);
        return new PixelGrid(counts, exposure, readReference(countsFile));
    }

    public int[][] readCounts(File f) throws IOException {
        double[][] data = readImage(f);
        int[][] counts = new int[data.length][];
        for (int y = 0; y < data.length; y++) {
            counts[y] = new int[data[y].length];
            for (int x = 0; x < data[y].length; x++) {
                double v = data[y][x];
                counts[y][x] = Double.isFinite(v) && v > 0 ? (int) Math.round(v) : 0;
            }
        }
        return counts;
    }

    public float[][] readFloatImage(File f) throws IOException {
        double[][] data = readImage(f);
        float[][] out = new float[data.length][];
        for (int y = 0; y < data.length; y++) {
            out[y] = new float[data[y].length];
            for (int x = 0; x < data[y].length; x++) out[y][x] = (float) data[y][x];
        }
        return out;
    }

    public int[][] readIntImage(File f) throws IOException {
        try (Fits fits = new Fits(f)) {
            Object kernel = fits.getHDU(0).getKernel();
            if (kernel instanceof int[][]) return (int[][]) kernel;
            throw new IOException(f + " is not a 32-bit integer image");
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS image " + f + ": " + e.getMessage(), e);
        }
    }

    public CoordinateReference readReference(File f) throws IOException {
        try (Fits fits = new Fits(f)) {
            Header header = fits.getHDU(0).getHeader();
            if (!header.containsKey("CRPIX1")) return CoordinateReference.PIXEL;
            return new CoordinateReference(
                    header.getDoubleValue("CRPIX1", 1), header.getDoubleValue("CRPIX2", 1),
                    header.getDoubleValue("CRVAL1", 1), header.getDoubleValue("CRVAL2", 1),
                    header.getDoubleValue("CDELT1", 1), header.getDoubleValue("CDELT2", 1),
                    header.getStringValue("CTYPE1"), header.getStringValue("CTYPE2"));
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS header of " + f + ": " + e.getMessage(), e);
        }
    }

    /** BITPIX -32 image; NaN marks pixels without data. */
    public void writeMap(SpatialMap map, CoordinateReference ref, File f) throws IOException {
        write(map.values(), ref, f, Map.of("MAPNAME", map.name(), "BUNIT", map.unit(),
                "NODATA", "NaN"));
        logger.info("Wrote {} map to {}", map.name(), f);
    }

    /** BITPIX 32 image. */
    public void writeIntImage(int[][] data, CoordinateReference ref, File f, Map<String, Object> cards) throws IOException {
        write(data, ref, f, cards);
    }

    public void writeFloatImage(float[][] data, CoordinateReference ref, File f, Map<String, Object> cards) throws IOException {
        write(data, ref, f, cards);
    }

    private void write(Object data, CoordinateReference ref, File f, Map<String, ?> cards) throws IOException {
        File parent = f.getAbsoluteFile().getParentFile();
        if (parent != null) Files.createDirectories(parent.toPath());
        Files.deleteIfExists(f.toPath());
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            Header header = hdu.getHeader();
            CoordinateReference r = ref != null ? ref : CoordinateReference.PIXEL;
            header.addValue("CTYPE1", r.ctype1, "axis 1 type");
            header.addValue("CTYPE2", r.ctype2, "axis 2 type");
            header.addValue("CRPIX1", r.crpix1, "reference pixel, axis 1");
            header.addValue("CRPIX2", r.crpix2, "reference pixel, axis 2");
            header.addValue("CRVAL1", r.crval1, "reference value, axis 1");
            header.addValue("CRVAL2", r.crval2, "reference value, axis 2");
            header.addValue("CDELT1", r.cdelt1, "increment, axis 1");
            header.addValue("CDELT2", r.cdelt2, "increment, axis 2");
            for (Map.Entry<String, ?> e : cards.entrySet()) {
                Object v = e.getValue();
                if (v instanceof Integer) header.addValue(e.getKey(), ((Integer) v).intValue(), "");
                else if (v instanceof Number) header.addValue(e.getKey(), ((Number) v).doubleValue(), "");
                else header.addValue(e.getKey(), String.valueOf(v), "");
            }
            fits.addHDU(hdu);
            fits.write(f);
        } catch (FitsException e) {
            throw new IOException("Cannot write FITS image " + f + ": " + e.getMessage(), e);
        }
    }

    private double[][] readImage(File f) throws IOException {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new IOException(f + " has no primary image");
            double[][] data = toDouble(hdu.getKernel());
            if (data.length == 0) throw new IOException(f + " is not a 2-D image");
            double bzero = hdu.getBZero();
            double bscale = hdu.getBScale();
            if (bzero != 0 || bscale != 1) {
                // physical = BZERO + BSCALE * stored
                for (double[] row : data) {
                    for (int x = 0; x < row.length; x++) row[x] = bzero + bscale * row[x];
                }
            }
            return data;
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS image " + f + ": " + e.getMessage(), e);
        }
    }

    private double[][] toDouble(Object k) {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j];
            return d;
        }
        if (k instanceof int[][]) {
            int[][] s = (int[][]) k;
            double[][] d = new double[s.length][s[0].length];
            for (int i = 0; i < s.length; i++) for (int j = 0; j < s[0].length; j++) d[i][j] = s[i][j];
            return d;
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            double[][] d = new double[f.length][f[0].length];
            for (int i = 0; i < f.length; i++) for (int j = 0; j < f[0].length; j++) d[i][j] = f[i][j];
            return d;
        }
        if (k instanceof double[][]) {
            return (double[][]) k;
        }
        // BITPIX 8 is the only unsigned type; the others take their offset from BZERO
        if (k instanceof byte[][]) {
            byte[][] b = (byte[][]) k;
            double[][] d = new double[b.length][b[0].length];
            for (int i = 0; i < b.length; i++) for (int j = 0; j < b[0].length; j++) d[i][j] = b[i][j] & 0xFF;
            return d;
        }
        return new double[0][0];
    }
}
