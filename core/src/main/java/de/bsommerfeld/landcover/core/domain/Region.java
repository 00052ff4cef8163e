package de.bsommerfeld.landcover.core.domain;

/**
 * Axis-aligned window on the pixel grid, {@code [minX, maxX) x [minY, maxY)}.
 * Regions carry no coordinate reference system.
 */
public record Region(int minX, int minY, int maxX, int maxY) {

    public Region {
        if (minX >= maxX || minY >= maxY) {
            throw new IllegalArgumentException("Region must have positive extent: [" + minX + ", " + maxX
                    + ") x [" + minY + ", " + maxY + ")");
        }
    }

    /** Region covering the full extent of {@code raster}. */
    public static Region covering(Raster raster) {
        return new Region(0, 0, raster.width(), raster.height());
    }

    public boolean contains(int x, int y) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    /** Whether this region overlaps a {@code width x height} grid anchored at the origin. */
    public boolean intersects(int width, int height) {
        return minX < width && minY < height && maxX > 0 && maxY > 0;
    }
}
