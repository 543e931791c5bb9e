/**
 * Recursive sanitization of untrusted JSON payloads.
 *
 * <p>{@link fr.lapetina.inference.gateway.security.SecurityValidator} walks the payload tree
 * and runs every {@link fr.lapetina.inference.gateway.security.PayloadCheck} at each node.
 * New checks plug in without touching the walk.
 */
package fr.lapetina.inference.gateway.security;
