package com.partner.match.service;

import com.partner.match.dto.Participant;

import java.util.OptionalDouble;

/**
 * Geocoding collaborator returning a scalar distance between two participants' locations,
 * or empty when either location cannot be resolved.
 */
@FunctionalInterface
public interface DistanceProvider {
    OptionalDouble distanceBetween(Participant left, Participant right);
}
