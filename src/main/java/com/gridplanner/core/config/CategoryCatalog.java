package com.gridplanner.core.config;

import com.gridplanner.core.model.CategoryStyle;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable lookup from category key to display color and priority weight.
 * <p>
 * Built once at start-up and handed to the layout engines; new categories are added
 * through configuration, never by changing layout code.
 */
public final class CategoryCatalog {

    public static final String DEFAULT_COLOR = "#CCCCCC";
    public static final int NEUTRAL_WEIGHT = 5;

    private final Map<String, CategoryStyle> styles;

    private CategoryCatalog(Map<String, CategoryStyle> styles) {
        this.styles = Collections.unmodifiableMap(styles);
    }

    public static CategoryCatalog of(Collection<CategoryStyle> categories) {
        var map = new LinkedHashMap<String, CategoryStyle>();
        for (CategoryStyle style : categories) {
            String key = normalize(style.name());
            map.put(key, new CategoryStyle(key, style.displayName(), style.color(), style.weight(), style.milestone()));
        }
        return new CategoryCatalog(map);
    }

    /** The planner's built-in categories. */
    public static CategoryCatalog defaults() {
        return of(List.of(
                new CategoryStyle("PROPOSAL", "Proposal", "#4A90E2", 1, false),
                new CategoryStyle("LASER", "Laser System", "#F5A623", 2, false),
                new CategoryStyle("IMAGING", "Imaging", "#7ED321", 3, false),
                new CategoryStyle("ADMIN", "Administrative", "#BD10E0", 4, false),
                new CategoryStyle("DISSERTATION", "Dissertation", "#D0021B", 5, false),
                new CategoryStyle("RESEARCH", "Research", "#50E3C2", 6, false),
                new CategoryStyle("PUBLICATION", "Publication", "#B8E986", 7, false),
                new CategoryStyle("MILESTONE", "Milestone", "#F8E71C", 5, true)
        ));
    }

    /**
     * Returns the style for a category, or a neutral gray style for unknown or blank names.
     */
    public CategoryStyle lookup(String category) {
        String key = normalize(category);
        CategoryStyle style = styles.get(key);
        if (style != null) {
            return style;
        }
        return new CategoryStyle(key, category == null ? "" : category, DEFAULT_COLOR, NEUTRAL_WEIGHT, false);
    }

    public boolean contains(String category) {
        return styles.containsKey(normalize(category));
    }

    public Collection<CategoryStyle> all() {
        return styles.values();
    }

    private static String normalize(String name) {
        return name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
    }
}
