/**
 * Micrometer metrics with Prometheus exposition.
 */
package fr.lapetina.steering.infrastructure.metrics;
