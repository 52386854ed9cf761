package ai.genflow.workflow.engine.collaborator.http;

import ai.genflow.workflow.engine.collaborator.CollaboratorKind;
import ai.genflow.workflow.engine.collaborator.WebSearchClient;
import ai.genflow.workflow.engine.collaborator.WebSearchHit;
import ai.genflow.workflow.engine.config.CollaboratorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Web search through SerpAPI or Brave Search, selected by {@code genflow.collaborators.web-search.provider}.
 * A missing provider or API key disables search and every query returns no hits.
 */
public class HttpWebSearchClient implements WebSearchClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpWebSearchClient.class);

    static final String SERPAPI_URL = "https://serpapi.com/search";
    static final String BRAVE_URL = "https://api.search.brave.com/res/v1/web/search";

    enum Provider {
        NONE,
        SERPAPI,
        BRAVE
    }

    private final RestClient restClient;
    private final Provider provider;
    private final String apiKey;

    public HttpWebSearchClient(CollaboratorProperties properties, RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
        this.apiKey = properties.getWebSearch().getApiKey();
        this.provider = resolveProvider(properties.getWebSearch().getProvider(), apiKey);
    }

    Provider getProvider() {
        return provider;
    }

    @Override
    public List<WebSearchHit> search(String query, int maxResults) {
        try {
            return switch (provider) {
                case NONE -> {
                    logger.debug("Web search disabled, no provider configured");
                    yield List.of();
                }
                case SERPAPI -> searchSerpApi(query, maxResults);
                case BRAVE -> searchBrave(query, maxResults);
            };
        } catch (RestClientException ex) {
            throw CollaboratorHttpErrors.translate(CollaboratorKind.WEB_SEARCH, ex);
        }
    }

    private List<WebSearchHit> searchSerpApi(String query, int maxResults) {
        JsonNode body = restClient.get()
                .uri(SERPAPI_URL + "?q={q}&api_key={key}&engine=google&num={num}&format=json",
                        query, apiKey, maxResults)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .body(JsonNode.class);
        List<WebSearchHit> hits = collectHits(body == null ? null : body.path("organic_results"),
                "link", "snippet", maxResults);
        logger.info("SerpAPI search completed results={}", hits.size());
        return hits;
    }

    private List<WebSearchHit> searchBrave(String query, int maxResults) {
        JsonNode body = restClient.get()
                .uri(BRAVE_URL + "?q={q}&count={count}&search_lang=en&safesearch=moderate", query, maxResults)
                .accept(MediaType.APPLICATION_JSON)
                .header("X-Subscription-Token", apiKey)
                .retrieve()
                .body(JsonNode.class);
        List<WebSearchHit> hits = collectHits(body == null ? null : body.path("web").path("results"),
                "url", "description", maxResults);
        logger.info("Brave search completed results={}", hits.size());
        return hits;
    }

    private static List<WebSearchHit> collectHits(JsonNode results, String urlField, String snippetField,
                                                  int maxResults) {
        List<WebSearchHit> hits = new ArrayList<>();
        if (results == null || !results.isArray()) {
            return hits;
        }
        for (JsonNode result : results) {
            if (hits.size() >= maxResults) {
                break;
            }
            String url = result.path(urlField).asText("");
            if (url.isBlank()) {
                continue;
            }
            hits.add(new WebSearchHit(result.path("title").asText(""), result.path(snippetField).asText(""), url));
        }
        return hits;
    }

    static Provider resolveProvider(String configured, String apiKey) {
        String name = configured == null ? "none" : configured.trim().toLowerCase(Locale.ROOT);
        Provider provider = switch (name) {
            case "serpapi" -> Provider.SERPAPI;
            case "brave" -> Provider.BRAVE;
            case "", "none" -> Provider.NONE;
            default -> {
                logger.warn("Unknown web search provider={}, web search disabled", configured);
                yield Provider.NONE;
            }
        };
        if (provider != Provider.NONE && (apiKey == null || apiKey.isBlank())) {
            logger.warn("Web search provider={} selected without an API key, web search disabled", name);
            return Provider.NONE;
        }
        return provider;
    }
}
