package com.adminframe.core.content;

import com.adminframe.api.exception.ConfigurationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 虚拟资源（卡片、视图）的命名规则
 * <p>
 * 点分名形如 {@code app.kind.slug}，例如 {@code shop.cards.sales-total}。
 */
public final class VirtualContentNamer {

    public static final String KIND_CARDS = "cards";
    public static final String KIND_VIEWS = "views";

    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");

    private VirtualContentNamer() {
    }

    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String slug = NON_SLUG.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    /**
     * 虚拟资源的 model_slug 部分，形如 {@code cards.sales-total}
     */
    public static String modelSlug(String kind, String key) {
        return requireSlug(kind, "kind") + "." + requireSlug(key, "key");
    }

    public static String makeDotted(String app, String kind, String key) {
        return requireSlug(app, "app") + "." + modelSlug(kind, key);
    }

    private static String requireSlug(String value, String part) {
        String slug = slugify(value);
        if (slug.isEmpty()) {
            throw new ConfigurationException("Virtual content " + part + " must not be empty: '" + value + "'");
        }
        return slug;
    }
}
