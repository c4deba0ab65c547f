package com.barthel.proforma.domain.model;

/**
 * Industry sector a set of project inputs belongs to. Each sector is served by
 * its own projection service.
 */
public enum Sector {
    SOLAR,
    CONSULTING
}
