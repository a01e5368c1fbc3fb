/**
 * Tool contract and lifecycle.
 * <p>
 * A tool is constructed uninitialized, receives its {@link com.geotool.api.ToolContext} once via
 * {@link com.geotool.tools.GisTool#initialize}, is validated, then run. {@link com.geotool.tools.AbstractGisTool}
 * implements everything except {@code run()} and the declaration table. Tools are contributed by
 * {@link com.geotool.tools.GisToolProvider}s (discovered via {@link java.util.ServiceLoader},
 * META-INF/services/com.geotool.tools.GisToolProvider) and created through {@link com.geotool.tools.ToolRegistry}.
 */
package com.geotool.tools;
