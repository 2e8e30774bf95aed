/**
 * OSPFv2 value types: neighbor and interface states, LSAs with their Fletcher checksum, the link state database and
 * the five packet types.
 */
package ca.gc.cra.netsim.domain.ospf;
