package com.example.relayserver.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 多段参数组：共享同一基础描述的若干 NormalizedSetting
 */
public class MultipartGroup {

    private final String base;
    private final List<NormalizedSetting> parts = new ArrayList<>();

    public MultipartGroup(String base) {
        this.base = base;
    }

    public String getBase() {
        return base;
    }

    public List<NormalizedSetting> getParts() {
        return Collections.unmodifiableList(parts);
    }

    void addPart(NormalizedSetting setting) {
        parts.add(setting);
    }

    /**
     * 段数 = 最大段序号
     */
    public int getTotalParts() {
        int max = 0;
        for (NormalizedSetting part : parts) {
            if (part.getMultipartPartIndex() != null) {
                max = Math.max(max, part.getMultipartPartIndex());
            }
        }
        return max;
    }

    /**
     * 由分组器按已分配段序号顺序填入
     */
    public static MultipartGroup of(String base, List<NormalizedSetting> orderedParts) {
        MultipartGroup group = new MultipartGroup(base);
        for (NormalizedSetting part : orderedParts) {
            group.addPart(part);
        }
        return group;
    }
}
