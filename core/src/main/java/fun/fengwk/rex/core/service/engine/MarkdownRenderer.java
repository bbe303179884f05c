package fun.fengwk.rex.core.service.engine;

import com.vladsch.flexmark.html2md.converter.FlexmarkHtmlConverter;
import com.vladsch.flexmark.util.data.MutableDataSet;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Renders the main content fragment picked by {@link MainContentExtractor} into the markdown body
 * of an {@link ExtractedDocument}. Headings are always ATX so that documents from every extraction
 * mode share one heading style, and runs of blank lines left by stripped boilerplate are collapsed.
 *
 * @author fengwk
 */
@Component
public class MarkdownRenderer {

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private final FlexmarkHtmlConverter converter;

    public MarkdownRenderer() {
        MutableDataSet options = new MutableDataSet();
        options.set(FlexmarkHtmlConverter.SETEXT_HEADINGS, false);
        options.set(FlexmarkHtmlConverter.UNORDERED_LIST_DELIMITER, '*');
        options.set(FlexmarkHtmlConverter.LIST_ITEM_INDENT, 4);
        options.set(FlexmarkHtmlConverter.LIST_CONTENT_INDENT, true);
        options.set(FlexmarkHtmlConverter.DIV_AS_PARAGRAPH, true);
        this.converter = FlexmarkHtmlConverter.builder(options).build();
    }

    public String render(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        String markdown = converter.convert(html);
        return EXCESS_BLANK_LINES.matcher(markdown).replaceAll("\n\n").trim();
    }

}
