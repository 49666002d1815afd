// Copyright © 2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scrivener.rtf;

import java.util.Locale;
import scrivener.util.Trace;
import scrivener.util.condition.ConditionContext;
import scrivener.util.condition.MessageSupplier;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * A document being authored.
 * <p>
 * Content is added front to back: {@link #openParagraph(String, String)} starts a paragraph, {@link #addText(String)}
 * and friends append runs to it, {@link #openFootnote(String, String, String)} starts a footnote inside it. Opening a
 * paragraph closes the previous one, and a footnote along with it; opening a footnote closes the previous footnote.
 * Explicit closing is only needed to get back from a footnote to its paragraph's text.
 * <p>
 * Authoring is permissive: adding text with no paragraph open, or opening a footnote outside a paragraph, is not
 * prevented, and produces malformed RTF. The latter is at least signaled as a {@link StrayFootnoteCondition}.
 * <p>
 * Documents are not thread-safe. Use {@link Serializer} to produce the final RTF.
 */
public final class Document {
    /**
     * Initializes a new document using the given template with the default options.
     */
    public Document(final DocumentTemplate template) {
        this(template, DocumentOptions.defaults());
    }

    /**
     * Initializes a new document using the given template and options.
     * <p>
     * Default styles in the options that the template doesn't have are signaled as {@link StyleNotFoundCondition}s and
     * replaced by the template's defaults.
     */
    @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Templates are immutable")
    public Document(final DocumentTemplate template, final DocumentOptions options) {
        this.template = template;
        title = options.title();
        author = options.author();
        filename = options.effectiveFilename();
        defaultLanguage = options.defaultLanguage();
        asianDefaultLanguage = options.asianDefaultLanguage();
        layout = options.layout();
        footnoteOptions = options.footnoteOptions();
        verbose = options.verbose();
        paragraphStyle = template.defaultStyle(StyleKind.PARAGRAPH);
        footnoteStyle = template.defaultStyle(StyleKind.FOOTNOTE);
        final var requestedParagraphStyle = options.paragraphStyle();
        if (requestedParagraphStyle != null) {
            paragraphStyle = resolveStyle(requestedParagraphStyle, StyleKind.PARAGRAPH);
        }
        final var requestedFootnoteStyle = options.footnoteStyle();
        if (requestedFootnoteStyle != null) {
            footnoteStyle = resolveStyle(requestedFootnoteStyle, StyleKind.FOOTNOTE);
        }
        notice(() -> "Document created with title \"" + title + "\".");
    }

    /**
     * Opens an empty paragraph in the default paragraph style.
     */
    public void openParagraph() {
        openParagraph("", "");
    }

    /**
     * Opens a paragraph in the default paragraph style, starting with the given text.
     */
    public void openParagraph(final String text) {
        openParagraph(text, "");
    }

    /**
     * Opens a paragraph in the given style, starting with the given text.
     * <p>
     * The open paragraph, and the open footnote, if any, are closed first. An empty or unknown style identifier
     * selects the default paragraph style; see {@link #resolveStyle(String, StyleKind)}.
     */
    public void openParagraph(final String text, final String styleId) {
        closeParagraph();
        final var style = resolveStyle(styleId, StyleKind.PARAGRAPH);
        paragraphOpen = true;
        body.append("{\\pard ").append(style.applyMarkup());
        RtfEncoder.encodeTo(body, text);
        notice(() -> text.isEmpty() ? "Open paragraph." : "Open paragraph: " + text);
    }

    /**
     * Closes the open footnote, if any, then the open paragraph, if any.
     * <p>
     * Does nothing when nothing is open.
     */
    public void closeParagraph() {
        closeFootnote();
        if (paragraphOpen) {
            body.append("\\par}\n");
            paragraphOpen = false;
            notice(() -> "Close paragraph.");
        }
    }

    /**
     * Appends plain text to the open paragraph or footnote.
     */
    public void addText(final String text) {
        RtfEncoder.encodeTo(body, text);
        notice(() -> "Text: " + text);
    }

    /**
     * Appends text with the given character formatting to the open paragraph or footnote.
     */
    public void addText(final String text, final TextFormat format) {
        body.append('{').append(format.controlWords()).append(' ');
        RtfEncoder.encodeTo(body, text);
        body.append('}');
        notice(() -> "Text (" + format.controlWords() + "): " + text);
    }

    public void bold(final String text) {
        addText(text, TextFormat.BOLD);
    }

    public void italic(final String text) {
        addText(text, TextFormat.ITALIC);
    }

    public void subscript(final String text) {
        addText(text, TextFormat.SUBSCRIPT);
    }

    public void superscript(final String text) {
        addText(text, TextFormat.SUPERSCRIPT);
    }

    public void smallCaps(final String text) {
        addText(text, TextFormat.SMALL_CAPS);
    }

    /**
     * Opens an automatically numbered footnote in the default footnote style.
     */
    public void openFootnote(final String text) {
        openFootnote(text, "", automaticAnchor);
    }

    /**
     * Opens an automatically numbered footnote in the given style.
     */
    public void openFootnote(final String text, final String styleId) {
        openFootnote(text, styleId, automaticAnchor);
    }

    /**
     * Opens a footnote in the given style, marked with the given anchor.
     * <p>
     * The open footnote, if any, is closed first; the paragraph stays open. An empty or unknown style identifier
     * selects the default footnote style. The anchor appears both in the text and at the start of the footnote: pass
     * {@link #automaticAnchor} for automatic numbering, anything else is taken as literal text, such as {@code *}.
     */
    public void openFootnote(final String text, final String styleId, final String anchor) {
        closeFootnote();
        if (!paragraphOpen) {
            ConditionContext.signal(new StrayFootnoteCondition());
        }
        final var style = resolveStyle(styleId, StyleKind.FOOTNOTE);
        final var anchorMarkup = anchor.equals(automaticAnchor) ? anchor : RtfEncoder.encode(anchor);
        footnoteOpen = true;
        body.append("{\\super ").append(anchorMarkup)
            .append("{\\footnote ").append(anchorMarkup).append("\\pard\\plain ")
            .append(style.applyMarkup());
        RtfEncoder.encodeTo(body, text);
        notice(() -> "Open footnote: " + text);
    }

    /**
     * Closes the open footnote, if any, returning to its paragraph.
     * <p>
     * Does nothing when no footnote is open.
     */
    public void closeFootnote() {
        if (footnoteOpen) {
            body.append("}}\n");
            footnoteOpen = false;
            notice(() -> "Close footnote.");
        }
    }

    /**
     * Applies the named layout preset, such as {@code A4}.
     *
     * @see #setLayout(PageLayoutRequest)
     */
    public void setLayout(final String presetName) {
        setLayout(PageLayoutRequest.preset(presetName));
    }

    /**
     * Changes the page layout.
     * <p>
     * Each field takes, in order of preference: the explicit length in the request, if given and not negative; the
     * preset's value, if a preset is named; the current value. Unknown preset names are signaled as fatal
     * {@link UnknownLayoutCondition}s, malformed lengths as fatal {@link LengthParseErrorCondition}s. The layout is only
     * changed once everything has been validated.
     */
    public void setLayout(final PageLayoutRequest request) {
        try (final var trace = new Trace(() -> "Setting the page layout of document \"" + title + '"')) {
            trace.use();
            final var height = Twips.parse(request.height());
            final var width = Twips.parse(request.width());
            final var top = Twips.parse(request.topMargin());
            final var bottom = Twips.parse(request.bottomMargin());
            final var left = Twips.parse(request.leftMargin());
            final var right = Twips.parse(request.rightMargin());
            final var base = baseLayout(request.preset());
            layout = new PageLayout(
                pick(height, base.height()),
                pick(width, base.width()),
                pick(top, base.topMargin()),
                pick(bottom, base.bottomMargin()),
                pick(left, base.leftMargin()),
                pick(right, base.rightMargin())
            );
            notice(() -> request.preset().isEmpty() ? "Layout set." : "Layout set to \"" + request.preset() + "\".");
        }
    }

    public PageLayout layout() {
        return layout;
    }

    public FootnoteOptions footnoteOptions() {
        return footnoteOptions;
    }

    public void setFootnoteOptions(final FootnoteOptions options) {
        footnoteOptions = options;
    }

    /**
     * Returns the style with the given identifier.
     * <p>
     * If there's no such style, the default style for the given kind is returned instead. A non-empty identifier that
     * doesn't match is also signaled as a non-fatal {@link StyleNotFoundCondition}; the empty identifier silently
     * selects the default. Never fails.
     */
    public Style resolveStyle(final String styleId, final StyleKind kind) {
        final var style = template.findStyle(styleId);
        if (style != null) {
            return style;
        }
        final var fallback = defaultStyle(kind);
        if (!styleId.isEmpty()) {
            ConditionContext.signal(new StyleNotFoundCondition(styleId, kind, fallback));
        }
        return fallback;
    }

    /**
     * Returns the style used for paragraphs or footnotes when none is asked for.
     */
    public Style defaultStyle(final StyleKind kind) {
        return switch (kind) {
            case PARAGRAPH -> paragraphStyle;
            case FOOTNOTE -> footnoteStyle;
        };
    }

    /**
     * Changes the style used for paragraphs or footnotes when none is asked for.
     * <p>
     * The identifier is resolved with {@link #resolveStyle(String, StyleKind)}, so an unknown one leaves the default
     * unchanged.
     */
    public void setDefaultStyle(final String styleId, final StyleKind kind) {
        final var style = resolveStyle(styleId, kind);
        switch (kind) {
            case PARAGRAPH -> paragraphStyle = style;
            case FOOTNOTE -> footnoteStyle = style;
        }
        notice(() -> "Default " + kind.name().toLowerCase(Locale.ROOT) + " style set to \"" + style.id() + "\".");
    }

    /**
     * Returns what is currently open.
     */
    public DocumentState state() {
        if (footnoteOpen) {
            return paragraphOpen ? DocumentState.FOOTNOTE_OPEN : DocumentState.STRAY_FOOTNOTE_OPEN;
        }
        return paragraphOpen ? DocumentState.PARAGRAPH_OPEN : DocumentState.NO_PARAGRAPH;
    }

    public boolean isParagraphOpen() {
        return paragraphOpen;
    }

    public boolean isFootnoteOpen() {
        return footnoteOpen;
    }

    /**
     * Returns the body markup accumulated so far.
     */
    public String bodyMarkup() {
        return body.toString();
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Templates are immutable")
    public DocumentTemplate template() {
        return template;
    }

    public String title() {
        return title;
    }

    public String author() {
        return author;
    }

    /**
     * Returns the base name, without extension, of the file this document is saved to.
     */
    public String filename() {
        return filename;
    }

    public int defaultLanguage() {
        return defaultLanguage;
    }

    public int asianDefaultLanguage() {
        return asianDefaultLanguage;
    }

    private PageLayout baseLayout(final String presetName) {
        if (presetName.isEmpty()) {
            return layout;
        }
        final var preset = LayoutPreset.byName(presetName);
        if (preset == null) {
            throw ConditionContext.error(new UnknownLayoutCondition(presetName));
        }
        return preset.layout();
    }

    private static int pick(final int requested, final int fallback) {
        return (requested < 0) ? fallback : requested;
    }

    private void notice(final MessageSupplier message) {
        if (verbose) {
            ConditionContext.signal(new AuthoringNoticeCondition(message.get()));
        }
    }

    /**
     * The anchor that makes the reader number footnotes automatically.
     */
    public static final String automaticAnchor = "\\chftn";

    private final DocumentTemplate template;
    private final String title;
    private final String author;
    private final String filename;
    private final int defaultLanguage;
    private final int asianDefaultLanguage;
    private final boolean verbose;
    private final StringBuilder body = new StringBuilder();
    private PageLayout layout;
    private FootnoteOptions footnoteOptions;
    private Style paragraphStyle;
    private Style footnoteStyle;
    private boolean paragraphOpen = false;
    private boolean footnoteOpen = false;
}
