/**
 * The ext API allows for associating arbitrary data with
 * instances of {@link io.github.tlang.core.ext.ExtContainer}.
 * <p>
 * Statements and blocks use it for their parent links, see
 * {@link io.github.tlang.core.ext.CommonExts}, storing those in fields as a fast-path.
 * The root of a tree carries its {@link io.github.tlang.core.ext.MetadataState}.
 */
package io.github.tlang.core.ext;
