/**
 * LayerMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.layermesh.layer.Layer} registers items and routes queries to a parent layer.</li>
 *   <li>{@code io.layermesh.model.ModelClass} is the item type that layers own and expose.</li>
 *   <li>{@code io.layermesh.serialization.ValueSerializer} turns live values into wire values and back.</li>
 *   <li>{@code io.layermesh.Main} bootstraps the CLI process.</li>
 * </ul>
 */
package io.layermesh;
