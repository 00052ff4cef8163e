/**
 * Boundary to the raster storage and compute engine.
 *
 * <pre>
 *   [Aggregation / Assessment]
 *            │
 *            ▼
 *      BackendGateway     ← timeouts at read boundaries
 *            │
 *            ▼
 *      RasterBackend      ← interface (engine swap via Guice)
 *            │
 *   InMemoryRasterBackend
 * </pre>
 *
 * Production deployments bind {@link de.bsommerfeld.landcover.backend.RasterBackend}
 * to an adapter for their distributed engine; the in-memory implementation
 * evaluates on the calling thread and backs the test suite.
 */
package de.bsommerfeld.landcover.backend;
