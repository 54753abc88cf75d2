package io.skymosaic.geometry;

public final class OutOfRangeTileException extends IllegalArgumentException {
    private final int tileIndex;
    private final int tileCount;

    public OutOfRangeTileException(int tileIndex, int tileCount) {
        super("Tile index " + tileIndex + " outside [0, " + tileCount + ")");
        this.tileIndex = tileIndex;
        this.tileCount = tileCount;
    }

    public int tileIndex() {
        return tileIndex;
    }

    public int tileCount() {
        return tileCount;
    }
}
