/**
 * Mutation-log replay: rebuilds registry state by applying newline-delimited JSON commands in order.
 */
package ca.gc.cra.sentinel.application.replay;
