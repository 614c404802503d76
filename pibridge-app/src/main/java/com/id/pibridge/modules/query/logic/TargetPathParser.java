package com.id.pibridge.modules.query.logic;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits {@code <base>;<leaf1>;<leaf2>...} targets into full paths.
 */
public final class TargetPathParser {

    public static final char POINT_SEPARATOR = '\\';
    public static final char ATTRIBUTE_SEPARATOR = '|';

    private TargetPathParser() {
    }

    public static String getBasePath(String target) {
        if (target == null) {
            return "";
        }
        int semiIndex = target.indexOf(';');
        return semiIndex < 0 ? target : target.substring(0, semiIndex);
    }

    /**
     * Leaves after the base path. A target without {@code ;} has none.
     */
    public static List<String> getTargets(String target) {
        if (target == null) {
            return List.of();
        }
        int semiIndex = target.indexOf(';');
        if (semiIndex < 0) {
            return List.of();
        }
        List<String> leaves = new ArrayList<>();
        for (String leaf : target.substring(semiIndex + 1).split(";", -1)) {
            if (!leaf.isEmpty()) {
                leaves.add(leaf);
            }
        }
        return leaves;
    }

    public static String fullPath(String basePath, String leaf, boolean isPiPoint) {
        return basePath + (isPiPoint ? POINT_SEPARATOR : ATTRIBUTE_SEPARATOR) + leaf;
    }
}
