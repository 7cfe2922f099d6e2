package com.kensa.image.model;

import java.util.List;

/**
 * 通过面积过滤后的区域集合，保持发现顺序（行扫描顺序）。
 */
public final class RegionSet {

    private static final RegionSet EMPTY = new RegionSet(List.of());

    private final List<Region> regions;

    public RegionSet(List<Region> regions) {
        this.regions = List.copyOf(regions);
    }

    public static RegionSet empty() {
        return EMPTY;
    }

    public List<Region> getRegions() {
        return regions;
    }

    public int count() {
        return regions.size();
    }

    public boolean isEmpty() {
        return regions.isEmpty();
    }

    /**
     * 所有保留区域的面积之和。
     */
    public double significantArea() {
        return regions.stream().mapToDouble(Region::getArea).sum();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof RegionSet && regions.equals(((RegionSet) o).regions));
    }

    @Override
    public int hashCode() {
        return regions.hashCode();
    }

    @Override
    public String toString() {
        return "RegionSet(count=" + count() + ", area=" + significantArea() + ")";
    }
}
