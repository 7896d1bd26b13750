/**
 * {@link io.github.tlang.core.passes.IRPass IR passes} that change the form of the IR.
 */
package io.github.tlang.core.passes.form;
