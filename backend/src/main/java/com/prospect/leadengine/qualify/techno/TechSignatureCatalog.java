package com.prospect.leadengine.qualify.techno;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public final class TechSignatureCatalog {
    public static final String TARGET_PROVIDER = "aws";
    public static final Set<String> MODERN_FRONTENDS = Set.of("react", "angular", "vue");
    public static final List<String> GENERATOR_CMS = List.of("wordpress", "drupal", "joomla", "wix", "squarespace");
    public static final List<String> SCRIPT_LIBRARIES = List.of("jquery", "bootstrap", "react", "angular", "vue");
    public static final String MANAGED_DATABASE_SERVICE = "rds";

    private static final List<TechSignature> SIGNATURES = List.of(
        new TechSignature(TARGET_PROVIDER, TechCategory.CLOUD_PROVIDER,
            List.of("amazonaws.com", "cloudfront.net", "elasticbeanstalk.com"),
            List.of("x-amz-", "x-amzn-")),
        new TechSignature("azure", TechCategory.CLOUD_PROVIDER,
            List.of("azurewebsites.net", "blob.core.windows.net", "azureedge.net"),
            List.of("x-ms-", "x-azure-ref")),
        new TechSignature("gcp", TechCategory.CLOUD_PROVIDER,
            List.of("appspot.com", "storage.googleapis.com", "googleusercontent.com"),
            List.of("x-goog-", "x-cloud-trace-context")),
        new TechSignature("wordpress", TechCategory.CMS,
            List.of("/wp-content/", "/wp-includes/"),
            List.of()),
        new TechSignature("magento", TechCategory.ECOMMERCE,
            List.of("/skin/frontend/", "mage/cookies", "magento"),
            List.of()),
        new TechSignature("shopify", TechCategory.ECOMMERCE,
            List.of("cdn.shopify.com", "myshopify.com"),
            List.of("x-shopid")),
        new TechSignature("google_analytics", TechCategory.ANALYTICS,
            List.of("google-analytics.com", "gtag/js", "googletagmanager.com"),
            List.of()),
        new TechSignature("hotjar", TechCategory.ANALYTICS,
            List.of("static.hotjar.com", "hotjar.com"),
            List.of()),
        new TechSignature("cloudflare", TechCategory.CDN,
            List.of("cdnjs.cloudflare.com", "cloudflare.com"),
            List.of("cf-ray", "cf-cache-status", "server: cloudflare")),
        new TechSignature("akamai", TechCategory.CDN,
            List.of("akamai.net", "akamaihd.net"),
            List.of("x-akamai-")),
        new TechSignature("mongodb", TechCategory.DATABASE,
            List.of("mongodb"),
            List.of()),
        new TechSignature("mysql", TechCategory.DATABASE,
            List.of("mysql"),
            List.of()),
        new TechSignature("postgresql", TechCategory.DATABASE,
            List.of("postgresql", "postgres"),
            List.of()),
        new TechSignature("react", TechCategory.FRONTEND,
            List.of("data-reactroot", "__next_data__", "/_next/", "react-dom"),
            List.of()),
        new TechSignature("angular", TechCategory.FRONTEND,
            List.of("ng-version", "ng-app", "angular.min.js"),
            List.of()),
        new TechSignature("vue", TechCategory.FRONTEND,
            List.of("data-v-", "vue.min.js", "vue.global"),
            List.of()),
        new TechSignature("nodejs", TechCategory.BACKEND,
            List.of(),
            List.of("x-powered-by: express", "x-powered-by: next.js")),
        new TechSignature("php", TechCategory.BACKEND,
            List.of(".php\""),
            List.of("x-powered-by: php")),
        new TechSignature("java", TechCategory.BACKEND,
            List.of(".jsp", ".jsf"),
            List.of("jsessionid")),
        new TechSignature("dotnet", TechCategory.BACKEND,
            List.of(".aspx", "__viewstate"),
            List.of("x-aspnet-version", "x-powered-by: asp.net"))
    );

    private static final Map<String, List<String>> TARGET_SERVICE_INDICATORS = orderedServices();

    private TechSignatureCatalog() {
    }

    public static List<TechSignature> signatures() {
        return SIGNATURES;
    }

    /**
     * Managed-service name to the page markers that suggest it is in use.
     */
    public static Map<String, List<String>> targetServiceIndicators() {
        return TARGET_SERVICE_INDICATORS;
    }

    public static Optional<TechCategory> categoryOf(String technology) {
        if (technology == null || technology.isBlank()) {
            return Optional.empty();
        }
        String key = technology.trim().toLowerCase(Locale.ROOT);
        for (TechSignature signature : SIGNATURES) {
            if (signature.name().equals(key)) {
                return Optional.of(signature.category());
            }
        }
        if (GENERATOR_CMS.contains(key)) {
            return Optional.of(TechCategory.CMS);
        }
        if (SCRIPT_LIBRARIES.contains(key)) {
            return Optional.of(TechCategory.LIBRARY);
        }
        return Optional.empty();
    }

    /**
     * Rebuilds a profile from technology names already recorded on a lead. Names that are also managed-service
     * keys count as target-service indicators.
     */
    public static TechnologyProfile profileFromNames(Collection<String> technologies) {
        TechnologyProfile.Builder builder = TechnologyProfile.builder();
        if (technologies == null) {
            return builder.build();
        }
        for (String technology : technologies) {
            if (technology == null || technology.isBlank()) {
                continue;
            }
            String key = technology.trim().toLowerCase(Locale.ROOT);
            Optional<TechCategory> category = categoryOf(key);
            if (category.isPresent()) {
                builder.add(key, category.get());
            } else {
                builder.addTechnology(key);
            }
            if (TARGET_SERVICE_INDICATORS.containsKey(key)) {
                builder.addTargetService(key);
            }
        }
        return builder.build();
    }

    private static Map<String, List<String>> orderedServices() {
        Map<String, List<String>> services = new LinkedHashMap<>();
        services.put("s3", List.of("s3.amazonaws.com", ".s3-", "s3-website"));
        services.put("cloudfront", List.of("cloudfront.net"));
        services.put("ec2", List.of("compute.amazonaws.com", "ec2"));
        services.put("rds", List.of("rds.amazonaws.com", "aurora"));
        services.put("lambda", List.of("lambda-url", "execute-api", "serverless"));
        services.put("elastic_beanstalk", List.of("elasticbeanstalk.com"));
        services.put("ecs", List.of("ecs.amazonaws.com", "fargate"));
        services.put("dynamodb", List.of("dynamodb"));
        services.put("redshift", List.of("redshift"));
        services.put("sagemaker", List.of("sagemaker"));
        return Collections.unmodifiableMap(services);
    }
}
