package com.sandy.fleet.view.registry;

import com.sandy.fleet.view.model.DeviceKey;
import com.sandy.fleet.view.model.DeviceRecord;
import com.sandy.fleet.view.model.DeviceSortCriterion;

import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * 设备列表排序。每个排序最终按 key 比较，保证是全序；倒序即正序取反。
 */
public final class DeviceComparators {

    public static final Comparator<Map.Entry<String, DeviceRecord>> FORWARD_ALPHA = Map.Entry.comparingByKey();

    public static final Comparator<Map.Entry<String, DeviceRecord>> REVERSE_ALPHA = FORWARD_ALPHA.reversed();

    public static final Comparator<Map.Entry<String, DeviceRecord>> FORWARD_KIND =
            Comparator.comparing(DeviceComparators::kindSortKey).thenComparing(FORWARD_ALPHA);

    public static final Comparator<Map.Entry<String, DeviceRecord>> REVERSE_KIND = FORWARD_KIND.reversed();

    public static final Comparator<Map.Entry<String, DeviceRecord>> FORWARD_STATUS =
            Comparator.comparingInt(DeviceComparators::statusOf).thenComparing(FORWARD_ALPHA);

    public static final Comparator<Map.Entry<String, DeviceRecord>> REVERSE_STATUS = FORWARD_STATUS.reversed();

    public static final Comparator<Map.Entry<String, DeviceRecord>> FORWARD_VERSION =
            Comparator.comparing(DeviceComparators::versionSortKey).thenComparing(FORWARD_ALPHA);

    public static final Comparator<Map.Entry<String, DeviceRecord>> REVERSE_VERSION = FORWARD_VERSION.reversed();

    private DeviceComparators() {
    }

    public static Comparator<Map.Entry<String, DeviceRecord>> forCriterion(DeviceSortCriterion criterion, boolean descending) {
        if (criterion == null) criterion = DeviceSortCriterion.ALPHABETICAL;
        switch (criterion) {
            case KIND:
                return descending ? REVERSE_KIND : FORWARD_KIND;
            case STATUS:
                return descending ? REVERSE_STATUS : FORWARD_STATUS;
            case VERSION:
                return descending ? REVERSE_VERSION : FORWARD_VERSION;
            case ALPHABETICAL:
            default:
                return descending ? REVERSE_ALPHA : FORWARD_ALPHA;
        }
    }

    // kind + key，与前端列表的排序字符串一致；kind 为空时只用 key
    static String kindSortKey(Map.Entry<String, DeviceRecord> e) {
        DeviceRecord r = e.getValue();
        String kind = r == null || r.getKind() == null ? "" : r.getKind();
        return kind + e.getKey();
    }

    static String versionSortKey(Map.Entry<String, DeviceRecord> e) {
        DeviceRecord r = e.getValue();
        return Objects.toString(r == null ? null : r.getVersion(), DeviceKey.MISSING) + e.getKey();
    }

    private static int statusOf(Map.Entry<String, DeviceRecord> e) {
        return e.getValue() == null ? 0 : e.getValue().statusCode();
    }
}
