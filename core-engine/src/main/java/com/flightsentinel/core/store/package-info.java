/**
 * Durable persistence of confirmed anomalies.
 *
 * @since 1.0.0
 */
package com.flightsentinel.core.store;
