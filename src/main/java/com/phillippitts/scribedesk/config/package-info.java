/**
 * Spring configuration: typed properties, executors, clock and logging context.
 *
 * <p>Properties are bound from {@code application.properties} and validated at startup.
 */
package com.phillippitts.scribedesk.config;
