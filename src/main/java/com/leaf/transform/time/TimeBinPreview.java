package com.leaf.transform.time;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * 分箱结果预览：箱数量与箱大小分布，以及前若干个箱的样例
 */
public class TimeBinPreview implements Serializable {
    private final int totalRows;
    private final int binCount;
    private final int minBinSize;
    private final int maxBinSize;
    private final double avgBinSize;
    /** 按首次出现顺序排列的 (箱标签, 行数) */
    private final List<Map.Entry<String, Integer>> sampleBins;

    public TimeBinPreview(int totalRows, int binCount, int minBinSize, int maxBinSize,
                          double avgBinSize, List<Map.Entry<String, Integer>> sampleBins) {
        this.totalRows = totalRows;
        this.binCount = binCount;
        this.minBinSize = minBinSize;
        this.maxBinSize = maxBinSize;
        this.avgBinSize = avgBinSize;
        this.sampleBins = List.copyOf(sampleBins);
    }

    public int getTotalRows() { return totalRows; }
    public int getBinCount() { return binCount; }
    public int getMinBinSize() { return minBinSize; }
    public int getMaxBinSize() { return maxBinSize; }
    public double getAvgBinSize() { return avgBinSize; }
    public List<Map.Entry<String, Integer>> getSampleBins() { return sampleBins; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total rows: %d%nNumber of bins: %d%nBin sizes: min=%d, max=%d, avg=%.1f%n",
                totalRows, binCount, minBinSize, maxBinSize, avgBinSize));
        for (Map.Entry<String, Integer> bin : sampleBins) {
            sb.append("  ").append(bin.getKey()).append(" : ").append(bin.getValue()).append(" rows\n");
        }
        return sb.toString();
    }
}
