package com.clustermap.model;

import java.util.Objects;

/**
 * Linear world coordinate reference of an image (FITS CRPIX/CRVAL/CDELT/CTYPE cards).
 * Carried from the input images to every derived map so they can be re-projected.
 */
public class CoordinateReference {

    /** Pixel coordinates only; used when the input carries no WCS. */
    public static final CoordinateReference PIXEL = new CoordinateReference(1, 1, 1, 1, 1, 1, "PIXEL", "PIXEL");

    public final double crpix1;
    public final double crpix2;
    public final double crval1;
    public final double crval2;
    public final double cdelt1;
    public final double cdelt2;
    public final String ctype1;
    public final String ctype2;

    public CoordinateReference(double crpix1, double crpix2, double crval1, double crval2,
                               double cdelt1, double cdelt2, String ctype1, String ctype2) {
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.crval1 = crval1;
        this.crval2 = crval2;
        this.cdelt1 = cdelt1;
        this.cdelt2 = cdelt2;
        this.ctype1 = ctype1 != null ? ctype1 : "";
        this.ctype2 = ctype2 != null ? ctype2 : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoordinateReference)) return false;
        CoordinateReference other = (CoordinateReference) o;
        return Double.compare(crpix1, other.crpix1) == 0 && Double.compare(crpix2, other.crpix2) == 0
                && Double.compare(crval1, other.crval1) == 0 && Double.compare(crval2, other.crval2) == 0
                && Double.compare(cdelt1, other.cdelt1) == 0 && Double.compare(cdelt2, other.cdelt2) == 0
                && ctype1.equals(other.ctype1) && ctype2.equals(other.ctype2);
    }

    @Override
    public int hashCode() { return Objects.hash(crpix1, crpix2, crval1, crval2, cdelt1, cdelt2, ctype1, ctype2); }

    @Override
    public String toString() {
        return ctype1 + "/" + ctype2 + " crpix=(" + crpix1 + ", " + crpix2 + ") crval=(" + crval1 + ", " + crval2
                + ") cdelt=(" + cdelt1 + ", " + cdelt2 + ")";
    }
}
