/**
 * REST API layer: controller and DTOs.
 *
 * <p>Exposes pattern retrieval through REST endpoints:
 * <ul>
 *   <li>Lookup - one pattern by coordinate, or a batch</li>
 *   <li>Search - keyword search by layer and lexicon</li>
 *   <li>Modules - seal-stack assembly with coherence report</li>
 *   <li>Nearest - stored coordinates closest to an address</li>
 *   <li>Stats and health - store counts</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.sealstack.api;
