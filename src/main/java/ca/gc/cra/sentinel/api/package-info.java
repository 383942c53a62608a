/**
 * Command-line entry points: the {@code sentinel} dispatcher and the mutation-log replay tool.
 */
package ca.gc.cra.sentinel.api;
