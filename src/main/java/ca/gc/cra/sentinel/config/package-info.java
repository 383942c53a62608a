/**
 * Configuration loading (SnakeYAML), layered merging, and the composition root that wires registries to
 * adapters.
 * <p><strong>Precedence:</strong> CLI &gt; YAML &gt; defaults.</p>
 */
package ca.gc.cra.sentinel.config;
