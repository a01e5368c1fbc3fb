/**
 * Builds a tool's parameters from its declaration table.
 * <p>
 * A tool lists one {@link com.geotool.parameters.discovery.ParameterDeclaration} per slot;
 * {@link com.geotool.parameters.discovery.ParameterDiscovery} turns the table into a
 * {@link com.geotool.parameters.discovery.ParameterSet}, binding label, position, required flag,
 * numeric range and default. Tools read their parameters back from the set by slot id.
 */
package com.geotool.parameters.discovery;
