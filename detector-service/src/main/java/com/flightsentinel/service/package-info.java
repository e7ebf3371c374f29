/**
 * Process wiring for the Flight Sentinel detector.
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.flightsentinel.service.DetectorService}: main entry
 * point</li>
 * <li>{@link com.flightsentinel.service.ServiceConfig}: environment-driven
 * configuration</li>
 * <li>{@link com.flightsentinel.service.HealthServer}: HTTP health/readiness
 * endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.flightsentinel.service;
