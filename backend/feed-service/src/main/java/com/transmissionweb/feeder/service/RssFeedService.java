package com.transmissionweb.feeder.service;

import com.rometools.rome.feed.synd.SyndEnclosure;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import com.transmissionweb.feeder.dto.CandidateItem;
import com.transmissionweb.feeder.exception.FeedFetchException;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Element;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * RSS/Atom 문서를 받아 엔트리를 {@link CandidateItem}으로 변환하는 서비스
 */
@Service
@Slf4j
public class RssFeedService {

    static final String ACCEPT_FEEDS = "application/rss+xml, application/atom+xml, application/xml, text/xml, */*";

    private final RestTemplate feedRestTemplate;

    public RssFeedService(@Qualifier("feedRestTemplate") RestTemplate feedRestTemplate) {
        this.feedRestTemplate = feedRestTemplate;
    }

    /**
     * RSS 피드를 조회하고 파싱
     * 엔트리는 문서 순서를 유지하며, 아이템이 없는 피드는 빈 목록을 반환합니다.
     *
     * @throws FeedFetchException 문서를 받지 못하면 NETWORK, 피드로 읽을 수 없으면 MALFORMED
     */
    public List<CandidateItem> fetch(String url) {
        log.debug("Fetching feed from: {}", url);
        byte[] document = download(url);
        SyndFeed feed = parse(url, document);

        List<CandidateItem> items = new ArrayList<>(feed.getEntries().size());
        for (SyndEntry entry : feed.getEntries()) {
            items.add(toCandidate(entry));
        }
        log.debug("Found {} entries in feed {}", items.size(), url);
        return items;
    }

    private byte[] download(String url) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.ACCEPT, ACCEPT_FEEDS);
        try {
            ResponseEntity<byte[]> response = feedRestTemplate.exchange(
                    url, HttpMethod.GET, new HttpEntity<>(headers), byte[].class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw FeedFetchException.network(url,
                        new IOException("HTTP " + response.getStatusCode().value()));
            }
            byte[] body = response.getBody();
            if (body == null || body.length == 0) {
                throw FeedFetchException.malformed(url, new IOException("empty document"));
            }
            return body;
        } catch (RestClientException | IllegalArgumentException e) {
            throw FeedFetchException.network(url, e);
        }
    }

    private SyndFeed parse(String url, byte[] document) {
        try (XmlReader reader = new XmlReader(new ByteArrayInputStream(document))) {
            return new SyndFeedInput().build(reader);
        } catch (FeedException | IOException | IllegalArgumentException e) {
            throw FeedFetchException.malformed(url, e);
        }
    }

    private CandidateItem toCandidate(SyndEntry entry) {
        String title = entry.getTitle();
        String link = blankToNull(entry.getLink());

        List<String> enclosures = new ArrayList<>();
        for (SyndEnclosure enclosure : entry.getEnclosures()) {
            String enclosureUrl = blankToNull(enclosure.getUrl());
            if (enclosureUrl != null) {
                enclosures.add(enclosureUrl);
            }
        }

        return new CandidateItem(title, uniqueId(entry, link, title), link, enclosures, customFields(entry));
    }

    /**
     * 식별자: RSS guid / Atom id → 아이템 링크 → 제목 순
     */
    private String uniqueId(SyndEntry entry, String link, String title) {
        String uri = blankToNull(entry.getUri());
        if (uri != null) {
            return uri;
        }
        if (link != null) {
            return link;
        }
        return blankToNull(title);
    }

    /**
     * 확장 마크업을 한 단계만 평탄화
     * 예: {@code <torrent><magnetURI>x</magnetURI></torrent>} → {@code torrent.magnetURI = x}
     */
    private Map<String, String> customFields(SyndEntry entry) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (Element element : entry.getForeignMarkup()) {
            List<Element> children = element.getChildren();
            if (children.isEmpty()) {
                putText(fields, element.getName(), element);
                continue;
            }
            for (Element child : children) {
                putText(fields, element.getName() + "." + child.getName(), child);
            }
        }
        return fields;
    }

    private static void putText(Map<String, String> fields, String key, Element element) {
        String text = blankToNull(element.getTextTrim());
        if (text != null) {
            fields.putIfAbsent(key, text);
        }
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
