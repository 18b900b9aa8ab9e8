package com.delta.feedscout.feed.source;

import com.delta.feedscout.feed.http.FeedHttpClient;
import com.delta.feedscout.feed.model.HttpFetchResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Loads the document that lists candidate feeds, from disk or over HTTP, and
 * pulls the candidate URL set out of it. PDF, HTML and plain text sources are
 * supported.
 */
@Service
public class FeedSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(FeedSourceLoader.class);
    private static final String SOURCE_ACCEPT = "application/pdf,text/html,text/plain;q=0.9,*/*;q=0.1";

    private final FeedHttpClient httpClient;

    public FeedSourceLoader(FeedHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public Set<String> loadCandidateUrls(String location) {
        String text = loadText(location);
        Set<String> urls = FeedUrlExtractor.extractUrls(text);
        log.info("Extracted {} candidate URLs from {}", urls.size(), location);
        return urls;
    }

    String loadText(String location) {
        if (location == null || location.isBlank()) {
            throw new FeedSourceException("No feed source location configured");
        }
        String value = location.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return download(value);
        }
        return readFile(Path.of(value));
    }

    private String download(String url) {
        HttpFetchResult fetch = httpClient.get(url, SOURCE_ACCEPT);
        if (!fetch.isSuccessful() || fetch.bodyBytes() == null) {
            String reason = fetch.errorCode() != null ? fetch.errorCode() : "http_" + fetch.statusCode();
            throw new FeedSourceException("Could not download feed source " + url + " (" + reason + ")");
        }
        if (isPdf(fetch.contentType(), url)) {
            return pdfToText(fetch.bodyBytes(), url);
        }
        Charset charset = fetch.charsetName() != null ? Charset.forName(fetch.charsetName()) : StandardCharsets.UTF_8;
        String body = new String(fetch.bodyBytes(), charset);
        if (isHtml(fetch.contentType(), url)) {
            return htmlToText(body, fetch.finalUrlOrRequested());
        }
        return body;
    }

    private String readFile(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        try {
            if (isPdf(null, name)) {
                return pdfToText(Files.readAllBytes(path), path.toString());
            }
            String body = Files.readString(path, StandardCharsets.UTF_8);
            if (isHtml(null, name)) {
                return htmlToText(body, "");
            }
            return body;
        } catch (IOException e) {
            throw new FeedSourceException("Could not read feed source " + path, e);
        }
    }

    private boolean isPdf(String contentType, String name) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("application/pdf")) {
            return true;
        }
        return name != null && name.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private boolean isHtml(String contentType, String name) {
        if (contentType != null && contentType.toLowerCase(Locale.ROOT).contains("html")) {
            return true;
        }
        String lowerName = name == null ? "" : name.toLowerCase(Locale.ROOT);
        return lowerName.endsWith(".html") || lowerName.endsWith(".htm");
    }

    private String pdfToText(byte[] pdf, String source) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            String text = new PDFTextStripper().getText(document);
            log.debug("Read {} pages of text from {}", document.getNumberOfPages(), source);
            return text;
        } catch (IOException e) {
            throw new FeedSourceException("Could not read PDF feed source " + source, e);
        }
    }

    // Links usually live in href attributes rather than visible text.
    private String htmlToText(String html, String baseUri) {
        Document document = Jsoup.parse(html, baseUri);
        StringBuilder text = new StringBuilder(document.text());
        for (Element link : document.select("a[href]")) {
            String href = link.absUrl("href");
            if (href.isBlank()) {
                href = link.attr("href");
            }
            text.append('\n').append(href);
        }
        return text.toString();
    }
}
