/**
 * Exposure tables: which properties of an item a remote caller may read, write or call.
 */
package io.layermesh.exposure;
