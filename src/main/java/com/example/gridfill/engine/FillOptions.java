package com.example.gridfill.engine;

import com.example.gridfill.engine.expression.Notation;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Per-fill switches. Build with {@code FillOptions.builder()}; unset fields take the defaults below.
 */
@Value
@Builder(toBuilder = true)
public class FillOptions {
    @Builder.Default
    String notationBegin = "${";
    @Builder.Default
    String notationEnd = "}";
    /** Keep the annotated template sheet of a multisheet area instead of deleting it. */
    @Builder.Default
    boolean keepTemplateSheet = false;
    /** When the template sheet is kept, hide it. */
    @Builder.Default
    boolean hideTemplateSheet = false;
    /** Abort on the first expression error instead of recording a diagnostic. */
    @Builder.Default
    boolean failFast = false;
    @Builder.Default
    boolean recalculateOnOpen = true;
    /** Attach a comment with the diagnostic message to every cell whose expression failed. */
    @Builder.Default
    boolean annotateErrors = false;
    /** Called before and after every template cell is copied, in registration order. */
    @Singular
    List<AreaListener> areaListeners;

    public static FillOptions defaults() {
        return FillOptions.builder().build();
    }

    public Notation notation() {
        return Notation.of(notationBegin, notationEnd);
    }
}
