/**
 * <strong>Purpose:</strong> Simulation configuration: validated {@link ca.gc.cra.netsim.config.SimulationConfig},
 * YAML loading and defaults/YAML/CLI layering.
 *
 * @since 0.1.0
 */
package ca.gc.cra.netsim.config;
