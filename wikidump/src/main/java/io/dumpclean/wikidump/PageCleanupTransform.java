package io.dumpclean.wikidump;

import com.codahale.metrics.Counter;
import com.codahale.metrics.MetricRegistry;
import io.dumpclean.core.Record;
import io.dumpclean.core.Transform;
import io.dumpclean.error.RecordRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLStreamException;

/**
 * Per-page policy run by the pipeline workers. Pages without a revision and redirect stubs have
 * no prose, so they are written exactly as read. Every other body goes through the {@link TextCleaner} with its link brackets
 * hidden behind placeholders, and the page is written with the cleaned body. A cleaner failure
 * drops that page only.
 */
public class PageCleanupTransform implements Transform<Page, String> {
    private static final Logger log = LoggerFactory.getLogger(PageCleanupTransform.class);

    public static final String REDIRECT_MARKER = "#REDIRECT";
    public static final String REDIRECTS = "cleanup.redirects";
    public static final String CLEANED = "cleanup.cleaned";

    private final TextCleaner cleaner;
    private final PageXmlWriter writer;
    private final Counter redirects;
    private final Counter cleaned;

    public PageCleanupTransform(TextCleaner cleaner, PageXmlWriter writer, MetricRegistry registry) {
        this.cleaner = cleaner;
        this.writer = writer;
        this.redirects = registry.counter(REDIRECTS);
        this.cleaned = registry.counter(CLEANED);
    }

    @Override
    public Record<String> apply(Record<Page> input) throws RecordRejectedException, XMLStreamException, InterruptedException {
        Page page = input.payload();
        log.debug("processing title: {}", page.title());

        if (page.revision() == null) {
            log.debug("no revision for {}, written as is", page.title());
            return input.withPayload(writer.write(page));
        }

        if (page.body().startsWith(REDIRECT_MARKER)) {
            redirects.inc();
            log.debug("redirect {} written as is", page.title());
            return input.withPayload(writer.write(page));
        }

        String result;
        try {
            result = cleaner.clean(LinkPlaceholders.protect(page.body()));
        } catch (TextCleanerException e) {
            throw new RecordRejectedException(page.title(), "error cleaning title " + page.title() + ". Skipping", e);
        }
        cleaned.inc();
        return input.withPayload(writer.write(page.withBody(LinkPlaceholders.restore(result))));
    }
}
