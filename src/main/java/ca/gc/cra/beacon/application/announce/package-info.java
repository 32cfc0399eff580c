/**
 * Service-instance heartbeat: periodic properties registration and keep-alive announcements.
 */
package ca.gc.cra.beacon.application.announce;
