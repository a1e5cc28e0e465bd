package com.brandflow.api;

import com.brandflow.workflow.model.VariantSet;

import java.util.List;

public record VariantSetView(String step, List<VariantView> variants, String selectedUrl) {

    public static VariantSetView from(VariantSet set) {
        if (set == null) {
            return null;
        }
        return new VariantSetView(set.step().key(),
                set.variants().stream().map(variant -> VariantView.from(variant, set.selectedUrl())).toList(),
                set.selectedUrl());
    }
}
