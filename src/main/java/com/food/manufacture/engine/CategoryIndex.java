package com.food.manufacture.engine;

import com.food.manufacture.domain.Oil;
import com.food.manufacture.domain.OilCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Oils grouped by refining category, computed once per model build. Every
 * category is present, with an empty member list when the catalog has none.
 */
public final class CategoryIndex {

    private final Map<OilCategory, List<Oil>> members;

    private CategoryIndex(Map<OilCategory, List<Oil>> members) {
        this.members = members;
    }

    public static CategoryIndex of(List<Oil> oils) {
        Map<OilCategory, List<Oil>> grouped = new EnumMap<>(OilCategory.class);
        for (OilCategory category : OilCategory.values()) {
            grouped.put(category, new ArrayList<>());
        }
        oils.forEach(oil -> grouped.get(oil.getCategory()).add(oil));
        grouped.replaceAll((category, list) -> Collections.unmodifiableList(list));
        return new CategoryIndex(Collections.unmodifiableMap(grouped));
    }

    public List<Oil> members(OilCategory category) {
        return members.get(category);
    }

    public Map<OilCategory, List<Oil>> asMap() {
        return members;
    }
}
