/**
 * Command-line entry points that build and run simulated labs.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, merges configuration, configures
 * logging and telemetry, then composes a {@link ca.gc.cra.netsim.application.sim.SimulationContext}.</p>
 * <p><strong>Concurrency:</strong> Lab runs are single-threaded on a virtual clock.</p>
 */
package ca.gc.cra.netsim.api;
