package com.purchasingpower.sealstack.search.impl;

import com.purchasingpower.sealstack.core.SealLayer;
import com.purchasingpower.sealstack.search.SealStackService;
import lombok.Value;

import java.util.Map;

/**
 * Default implementation of StoreStats.
 *
 * @since 1.0.0
 */
@Value
public class DefaultStoreStats implements SealStackService.StoreStats {

    int totalPatterns;
    Map<SealLayer, Long> patternsByLayer;
    Map<String, Long> patternsByLexicon;
}
