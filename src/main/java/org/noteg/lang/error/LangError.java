package org.noteg.lang.error;

import io.vavr.control.Option;
import org.noteg.lang.tree.SourceLocation;

/**
 * Common shape of every error surfaced by the toolchain: a human-readable message
 * and, where one is known, the source position it refers to.
 */
public interface LangError {
    String message();

    Option<SourceLocation> location();
}
