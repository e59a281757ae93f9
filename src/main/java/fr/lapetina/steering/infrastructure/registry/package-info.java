/**
 * Service discovery boundary. Instances and their health come from here; this library never probes.
 */
package fr.lapetina.steering.infrastructure.registry;
