package org.mmlc.compiler.internal.i18n;

import org.mmlc.compiler.api.SourceSpan;
import org.mmlc.compiler.frontend.ast.Literal;
import org.mmlc.compiler.frontend.ast.Ref;
import org.mmlc.compiler.frontend.ast.Term;
import org.mmlc.compiler.frontend.ast.types.TypeSpec;

import java.text.MessageFormat;
import java.util.Locale;
import java.util.ResourceBundle;

/**
 * Renders diagnostic texts from the {@code compiler_messages} bundle.
 * <p>
 * Arguments are rendered by kind before formatting: types through
 * {@link TypeSpec#render()}, spans as {@code file:line:col}, a missing type as {@code ?},
 * and everything else through {@link String#valueOf(Object)} so that numbers are not
 * locale-formatted. A missing key is a programming error and surfaces as a
 * {@link java.util.MissingResourceException}.
 */
public final class Messages {

    private static final String BUNDLE_BASE_NAME = "compiler_messages";
    private static volatile ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, Locale.ROOT);

    private Messages() {}

    /**
     * Switches to a translated bundle; keys missing there fall back to the base bundle.
     * @param locale The locale.
     */
    public static void setLocale(Locale locale) {
        bundle = ResourceBundle.getBundle(BUNDLE_BASE_NAME, locale);
    }

    /**
     * @param key The message key.
     * @param args The message arguments, rendered by kind.
     * @return The formatted message.
     */
    public static String get(String key, Object... args) {
        Object[] texts = new Object[args.length];
        for (int i = 0; i < args.length; i++) {
            texts[i] = render(args[i]);
        }
        return MessageFormat.format(bundle.getString(key), texts);
    }

    /**
     * Describes the left-hand side of an invalid application: a named value, a literal, or
     * an anonymous expression.
     * @param fn The applied term.
     * @return The description, e.g. {@code value 'f'}.
     */
    public static String applicationTarget(Term fn) {
        if (fn instanceof Ref ref) {
            return get("target.value", ref.name());
        }
        if (fn instanceof Literal.IntLit lit) {
            return get("target.literal", lit.value());
        }
        if (fn instanceof Literal.FloatLit lit) {
            return get("target.literal", lit.value());
        }
        if (fn instanceof Literal.BoolLit lit) {
            return get("target.literal", lit.value());
        }
        if (fn instanceof Literal.StringLit lit) {
            return get("target.literal", "\"" + lit.value() + "\"");
        }
        if (fn instanceof Literal.UnitLit) {
            return get("target.literal", "()");
        }
        return get("target.expression");
    }

    private static String render(Object arg) {
        if (arg == null) {
            return "?";
        }
        if (arg instanceof TypeSpec type) {
            return type.render();
        }
        if (arg instanceof SourceSpan span) {
            return span.fileName() + ":" + span.startLine() + ":" + span.startCol();
        }
        return String.valueOf(arg);
    }
}
