package com.watchpost.pipeline.acquisition;

public enum PixelFormat {
    /** One luminance byte per pixel */
    GRAY8(1),
    /** Three bytes per pixel, blue first */
    BGR24(3);

    final int bytesPerPixel;

    PixelFormat(int bytesPerPixel) {
        this.bytesPerPixel = bytesPerPixel;
    }

    public int bytesPerPixel() {
        return bytesPerPixel;
    }
}
