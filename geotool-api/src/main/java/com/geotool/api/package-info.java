/**
 * Contracts of the host application that tools run inside.
 * <ul>
 *   <li>{@link com.geotool.api.ToolContext} – what a tool receives at initialization: live layers, services, config</li>
 *   <li>{@link com.geotool.api.MessageService} – non-fatal user messages (validation failures)</li>
 *   <li>{@link com.geotool.api.LayerService} – adds files or in-memory datasources to the map</li>
 *   <li>{@link com.geotool.api.Datasource} – handle to a produced dataset; single owner at any time</li>
 * </ul>
 * Implementations live in the host; this module has no behaviour of its own.
 */
package com.geotool.api;
