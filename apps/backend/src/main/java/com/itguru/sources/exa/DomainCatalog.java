package com.itguru.sources.exa;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Topic categories with their preferred domains, plus vendor-specific domain boosts.
 */
@Slf4j
public final class DomainCatalog {

    public static final String IT_GENERAL = "it_general";

    private static final TypeReference<LinkedHashMap<String, List<String>>> DOMAIN_MAP = new TypeReference<>() {};

    /** Checked in order; first category with a matching keyword wins. */
    private static final Map<String, List<String>> CATEGORY_KEYWORDS = orderedKeywords();

    private final Map<String, List<String>> categories;
    private final Map<String, List<String>> vendors;

    public DomainCatalog(Map<String, List<String>> categories, Map<String, List<String>> vendors) {
        this.categories = Map.copyOf(categories);
        this.vendors = new LinkedHashMap<>(vendors);
    }

    /**
     * Reads {@code domain_categories} and {@code vendor_map}; each section missing from
     * the document, or an unreadable document, falls back to the built-in lists.
     */
    public static DomainCatalog load(InputStream in, ObjectMapper mapper) {
        DomainCatalog defaults = defaults();
        if (in == null) return defaults;
        try {
            JsonNode root = mapper.readTree(in);
            Map<String, List<String>> categories = root.has("domain_categories")
                    ? mapper.convertValue(root.get("domain_categories"), DOMAIN_MAP)
                    : defaults.categories;
            Map<String, List<String>> vendors = root.has("vendor_map")
                    ? mapper.convertValue(root.get("vendor_map"), DOMAIN_MAP)
                    : defaults.vendors;
            if (!categories.containsKey(IT_GENERAL)) {
                categories = new LinkedHashMap<>(categories);
                categories.put(IT_GENERAL, defaults.categories.get(IT_GENERAL));
            }
            return new DomainCatalog(categories, vendors);
        } catch (Exception e) {
            log.warn("[exa] domain catalog unreadable, using built-in lists: {}", e.getMessage());
            return defaults;
        }
    }

    public String categorize(String query) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> e : CATEGORY_KEYWORDS.entrySet()) {
            for (String kw : e.getValue()) {
                if (q.contains(kw)) return e.getKey();
            }
        }
        return IT_GENERAL;
    }

    /** General IT domains, then the category's, then vendor boosts; no duplicates. */
    public List<String> domainsFor(String category, String query) {
        Set<String> out = new LinkedHashSet<>(categories.getOrDefault(IT_GENERAL, List.of()));
        out.addAll(categories.getOrDefault(category, List.of()));
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT);
        vendors.forEach((vendor, domains) -> {
            if (q.contains(vendor.toLowerCase(Locale.ROOT))) out.addAll(domains);
        });
        return new ArrayList<>(out);
    }

    private static Map<String, List<String>> orderedKeywords() {
        Map<String, List<String>> m = new LinkedHashMap<>();
        m.put("cybersecurity", List.of("security", "vulnerability", "cve", "threat", "malware", "hack",
                "breach", "attack", "exploit", "phishing"));
        m.put("cloud_devops", List.of("aws", "azure", "gcp", "cloud", "docker", "kubernetes", "devops",
                "container", "serverless"));
        m.put("programming", List.of("python", "javascript", "java", "code", "programming", "development",
                "api", "framework", "library"));
        m.put("business_tech", List.of("business", "strategy", "market", "startup", "investment", "trends", "future"));
        m.put("research_academic", List.of("research", "study", "paper", "academic", "analysis", "methodology"));
        return m;
    }

    public static DomainCatalog defaults() {
        Map<String, List<String>> c = new LinkedHashMap<>();
        c.put("cybersecurity", List.of(
                "bleepingcomputer.com", "krebsonsecurity.com", "securityweek.com", "threatpost.com",
                "darkreading.com", "infosecurity-magazine.com", "cybersecuritynews.com", "hackread.com",
                "thehackernews.com", "securityboulevard.com", "cyberscoop.com", "recordedfuture.com",
                "nist.gov", "cisa.gov", "sans.org", "owasp.org", "mitre.org", "attack.mitre.org",
                "talosintelligence.com", "unit42.paloaltonetworks.com", "blog.talosintelligence.com",
                "crowdstrike.com", "mandiant.com", "rapid7.com", "tenable.com", "qualys.com",
                "github.com/advisories", "msrc.microsoft.com"));
        c.put("cloud_devops", List.of(
                "aws.amazon.com", "azure.microsoft.com", "cloud.google.com",
                "aws.amazon.com/blogs/security", "azure.microsoft.com/blog/topics/security",
                "cloud.google.com/blog/products/identity-security",
                "cloudsecurityalliance.org", "devops.com", "containerjournal.com", "kubernetes.io",
                "docker.com", "redhat.com", "vmware.com", "docs.nginx.com", "nginx.com", "istio.io",
                "envoyproxy.io", "developer.hashicorp.com", "helm.sh", "cncf.io"));
        c.put(IT_GENERAL, List.of(
                "techcrunch.com", "arstechnica.com", "zdnet.com", "computerworld.com", "infoworld.com",
                "techrepublic.com", "itpro.co.uk", "networkworld.com", "datacenterknowledge.com",
                "enterprisetech.com", "itbusinessedge.com"));
        c.put("programming", List.of(
                "stackoverflow.com", "github.com", "dev.to", "medium.com", "hackernoon.com",
                "freecodecamp.org", "codinghorror.com"));
        c.put("business_tech", List.of(
                "forbes.com", "businessinsider.com", "wired.com", "fastcompany.com", "venturebeat.com",
                "techcrunch.com", "recode.net"));
        c.put("research_academic", List.of(
                "arxiv.org", "acm.org", "ieee.org", "springer.com", "nature.com", "sciencedirect.com",
                "researchgate.net"));

        Map<String, List<String>> v = new LinkedHashMap<>();
        v.put("cisco", List.of("advisories.cisco.com", "blogs.cisco.com", "talosintelligence.com"));
        v.put("palo alto", List.of("paloaltonetworks.com", "unit42.paloaltonetworks.com",
                "docs.paloaltonetworks.com", "live.paloaltonetworks.com"));
        v.put("fortinet", List.of("fortinet.com", "docs.fortinet.com"));
        v.put("cloudflare", List.of("cloudflare.com", "blog.cloudflare.com", "developers.cloudflare.com",
                "docs.cloudflare.com"));
        v.put("okta", List.of("okta.com", "developer.okta.com", "help.okta.com"));
        v.put("auth0", List.of("auth0.com", "auth0.com/docs"));
        v.put("github", List.of("github.com", "docs.github.com", "github.com/advisories"));
        v.put("gitlab", List.of("gitlab.com", "docs.gitlab.com"));
        v.put("hashicorp", List.of("developer.hashicorp.com"));
        v.put("terraform", List.of("developer.hashicorp.com", "registry.terraform.io"));
        v.put("vault", List.of("developer.hashicorp.com"));
        v.put("consul", List.of("developer.hashicorp.com"));
        v.put("nginx", List.of("docs.nginx.com", "nginx.com"));
        v.put("istio", List.of("istio.io"));
        v.put("envoy", List.of("envoyproxy.io"));
        v.put("red hat", List.of("redhat.com", "access.redhat.com/security/cve"));
        v.put("ubuntu", List.of("ubuntu.com/security"));
        v.put("debian", List.of("security.debian.org"));
        v.put("microsoft", List.of("learn.microsoft.com", "msrc.microsoft.com"));
        v.put("apple", List.of("support.apple.com"));
        v.put("project zero", List.of("security.googleblog.com"));
        return new DomainCatalog(c, v);
    }
}
