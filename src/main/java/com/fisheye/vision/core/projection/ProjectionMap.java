package com.fisheye.vision.core.projection;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * 透视视角到鱼眼源图的逐像素坐标映射
 * <p>
 * mapX / mapY 与输出图同尺寸（CV_32FC1），存放每个输出像素要采样的源图小数坐标，
 * 坐标只保存这一份，逐像素查询也从 Mat 读取。
 * 构造后不可变，可在线程间共享，并可复用于同分辨率的任意源帧
 */
public final class ProjectionMap {
    private final ViewSpec viewSpec;
    private final int sourceWidth;
    private final int sourceHeight;
    private final Mat mapX;
    private final Mat mapY;

    ProjectionMap(ViewSpec viewSpec, int sourceWidth, int sourceHeight, float[] sourceXs, float[] sourceYs) {
        int width = viewSpec.getOutputWidth();
        int height = viewSpec.getOutputHeight();
        if (sourceXs.length != width * height || sourceYs.length != width * height) {
            throw new IllegalArgumentException("Map arrays do not match output size " + width + "x" + height);
        }
        this.viewSpec = viewSpec;
        this.sourceWidth = sourceWidth;
        this.sourceHeight = sourceHeight;
        this.mapX = new Mat(height, width, CvType.CV_32FC1);
        this.mapY = new Mat(height, width, CvType.CV_32FC1);
        this.mapX.put(0, 0, sourceXs);
        this.mapY.put(0, 0, sourceYs);
    }

    /**
     * 输出像素 (col, row) 对应的源图 X 坐标
     */
    public float sourceX(int col, int row) {
        checkBounds(col, row);
        return (float) mapX.get(row, col)[0];
    }

    /**
     * 输出像素 (col, row) 对应的源图 Y 坐标
     */
    public float sourceY(int col, int row) {
        checkBounds(col, row);
        return (float) mapY.get(row, col)[0];
    }

    /**
     * 映射是否落在源图内；落在外面的像素由合成器填充背景色
     */
    public boolean hasSourceData(int col, int row) {
        float x = sourceX(col, row);
        float y = sourceY(col, row);
        return x >= 0 && y >= 0 && x <= sourceWidth - 1 && y <= sourceHeight - 1;
    }

    private void checkBounds(int col, int row) {
        if (col < 0 || row < 0 || col >= getWidth() || row >= getHeight()) {
            throw new IndexOutOfBoundsException("Pixel (" + col + ", " + row + ") outside " + getWidth() + "x" + getHeight());
        }
    }

    Mat mapX() { return mapX; }
    Mat mapY() { return mapY; }

    public ViewSpec getViewSpec() { return viewSpec; }
    public int getSourceWidth() { return sourceWidth; }
    public int getSourceHeight() { return sourceHeight; }
    public int getWidth() { return viewSpec.getOutputWidth(); }
    public int getHeight() { return viewSpec.getOutputHeight(); }
}
