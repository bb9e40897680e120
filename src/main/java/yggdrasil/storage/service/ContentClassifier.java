package yggdrasil.storage.service;

import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ClassificationInput;
import yggdrasil.storage.dto.ContentProfile;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 内容分类器
 * 纯函数：相同输入必然得到逐位相同的画像，不做任何 I/O
 */
@Service
public class ContentClassifier {

    private static final Pattern TOKEN_SPLITTER = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern SENTENCE_SPLITTER = Pattern.compile("[.!?。！？;；]+");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("(?m)^\\s{0,3}#{1,6}\\s+\\S");
    private static final Pattern NAMED_HEADING =
        Pattern.compile("(?im)^\\s*(chapter|section|part|book|canto)\\s+([0-9]+|[ivxlcdm]+)\\b");
    private static final Pattern NUMBERED_SECTION = Pattern.compile("(?m)^\\s*\\d+(\\.\\d+)*[.)]?\\s+\\p{L}");
    private static final Pattern REFERENCE_MARKER = Pattern.compile("(?i)(https?://|www\\.|\\bdoi\\b|\\bisbn\\b)");

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her", "was", "one",
        "our", "out", "has", "his", "how", "its", "who", "did", "yes", "get", "him", "she", "too", "use",
        "that", "with", "have", "this", "will", "your", "from", "they", "been", "were", "which", "their",
        "what", "there", "would", "about", "into", "than", "then", "them", "these", "those", "when",
        "where", "while", "also", "such", "some", "only", "other", "each", "more", "most", "very", "upon",
        "shall", "should", "could", "does", "being", "over", "under", "here", "just", "because", "after",
        "before", "between", "through", "during", "without", "within", "among", "both", "either", "neither");

    /**
     * 领域关键词表，按声明顺序解决平局
     */
    private static final Map<String, List<String>> DOMAIN_KEYWORDS = new LinkedHashMap<>();

    static {
        DOMAIN_KEYWORDS.put("religion", List.of("god", "spiritual", "faith", "prayer", "divine", "sacred", "bible", "quran"));
        DOMAIN_KEYWORDS.put("philosophy", List.of("philosophy", "ethics", "metaphysics", "logic", "consciousness", "existence"));
        DOMAIN_KEYWORDS.put("science", List.of("research", "study", "analysis", "hypothesis", "experiment", "data", "theory"));
        DOMAIN_KEYWORDS.put("literature", List.of("novel", "story", "character", "plot", "literary", "fiction", "poetry"));
        DOMAIN_KEYWORDS.put("history", List.of("historical", "ancient", "medieval", "century", "civilization", "culture"));
        DOMAIN_KEYWORDS.put("technology", List.of("technology", "software", "computer", "digital", "programming", "algorithm"));
        DOMAIN_KEYWORDS.put("medicine", List.of("medical", "health", "treatment", "patient", "clinical", "disease", "therapy"));
        DOMAIN_KEYWORDS.put("mathematics", List.of("mathematics", "equation", "theorem", "proof", "number", "formula", "calculation"));
    }

    private static final Map<String, Double> CONTENT_TYPE_PRIOR = Map.of(
        "book", 0.9,
        "academic_paper", 0.9,
        "reference", 0.8,
        "large_document", 0.6,
        "medium_document", 0.5,
        "small_document", 0.4,
        "article", 0.6);

    private final StorageProperties.Classifier settings;
    private final Set<String> highValueDomains;

    public ContentClassifier(StorageProperties properties) {
        this.settings = properties.getClassifier();
        this.highValueDomains = properties.getPlacement().getHighValueDomains().stream()
            .map(domain -> domain.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    /**
     * 计算内容画像
     *
     * @param input 正文、声明大小、领域与内容类型
     * @return 四项分数均在 [0, 1] 的画像
     */
    public ContentProfile classify(ClassificationInput input) {
        String text = input.getText() == null ? "" : input.getText();
        String window = text.length() > settings.getAnalysisWindow()
            ? text.substring(0, settings.getAnalysisWindow())
            : text;

        List<String> tokens = tokenize(window);

        return ContentProfile.builder()
            .semanticComplexity(clamp(semanticComplexity(window, tokens)))
            .topicCoherence(clamp(topicCoherence(tokens)))
            .informationDensity(clamp(informationDensity(tokens)))
            .queryPotential(clamp(queryPotential(window, input.getDomain(), input.getContentType())))
            .wordCount(countWords(text))
            .characterCount(text.length())
            .keywords(extractKeywords(tokens))
            .build();
    }

    /**
     * 未声明领域时按关键词表推断，全部未命中返回 general
     */
    public String inferDomain(String text, String sourceLocator) {
        String content = text == null ? "" : text;
        if (content.length() > settings.getAnalysisWindow()) {
            content = content.substring(0, settings.getAnalysisWindow());
        }
        String contentLower = content.toLowerCase(Locale.ROOT);
        String locatorLower = sourceLocator == null ? "" : sourceLocator.toLowerCase(Locale.ROOT);

        String best = "general";
        int bestScore = 0;
        for (Map.Entry<String, List<String>> entry : DOMAIN_KEYWORDS.entrySet()) {
            int score = 0;
            for (String keyword : entry.getValue()) {
                if (contentLower.contains(keyword) || locatorLower.contains(keyword)) {
                    score++;
                }
            }
            if (score > bestScore) {
                best = entry.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * 未声明内容类型时先看来源地址，再按大小区间推断
     */
    public String inferContentType(String sourceLocator, long size) {
        String url = sourceLocator == null ? "" : sourceLocator.toLowerCase(Locale.ROOT);
        if (url.contains("book") || url.contains("ebook") || url.contains("gutenberg")) {
            return "book";
        }
        if (url.contains("paper") || url.contains("journal") || url.contains("arxiv")) {
            return "academic_paper";
        }
        if (url.contains("wiki") || url.contains("encyclopedia")) {
            return "reference";
        }
        if (size > 10_000_000L) {
            return "book";
        } else if (size > 1_000_000L) {
            return "large_document";
        } else if (size > 100_000L) {
            return "medium_document";
        }
        return "small_document";
    }

    /**
     * 0.5 * 词汇多样性 + 0.3 * 句长变异系数 + 0.2 * 平均词长
     */
    private double semanticComplexity(String window, List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        double typeTokenRatio = (double) new HashSet<>(tokens).size() / tokens.size();

        List<Integer> sentenceLengths = new ArrayList<>();
        for (String sentence : SENTENCE_SPLITTER.split(window)) {
            int length = tokenize(sentence).size();
            if (length > 0) {
                sentenceLengths.add(length);
            }
        }
        double variation = coefficientOfVariation(sentenceLengths);

        long letters = 0;
        for (String token : tokens) {
            letters += token.length();
        }
        double avgWordLength = (double) letters / tokens.size();

        return 0.5 * typeTokenRatio
            + 0.3 * Math.min(1.0, variation)
            + 0.2 * Math.min(1.0, avgWordLength / 10.0);
    }

    /**
     * 相邻分块信息词集合的 Jaccard 重叠均值，放大 3 倍后截断
     */
    private double topicCoherence(List<String> tokens) {
        if (tokens.size() < 10) {
            return 0.3;
        }
        int chunkTokens = Math.max(1, settings.getCoherenceChunkTokens());
        List<Set<String>> chunks = new ArrayList<>();
        for (int start = 0; start < tokens.size(); start += chunkTokens) {
            int end = Math.min(start + chunkTokens, tokens.size());
            Set<String> informative = new HashSet<>();
            for (String token : tokens.subList(start, end)) {
                if (isInformative(token)) {
                    informative.add(token);
                }
            }
            chunks.add(informative);
        }
        if (chunks.size() < 2) {
            return 0.5;
        }

        double total = 0.0;
        for (int i = 1; i < chunks.size(); i++) {
            total += jaccard(chunks.get(i - 1), chunks.get(i));
        }
        double mean = total / (chunks.size() - 1);
        return Math.min(1.0, mean * 3.0);
    }

    private double informationDensity(List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        Set<String> informative = new HashSet<>();
        for (String token : tokens) {
            if (isInformative(token)) {
                informative.add(token);
            }
        }
        return (double) informative.size() / tokens.size();
    }

    /**
     * 0.4 * 领域先验 + 0.3 * 结构标记 + 0.3 * 内容类型先验
     */
    private double queryPotential(String window, String domain, String contentType) {
        double domainPrior = domain != null && highValueDomains.contains(domain.toLowerCase(Locale.ROOT)) ? 1.0 : 0.5;

        int markerKinds = 0;
        if (MARKDOWN_HEADING.matcher(window).find() || NAMED_HEADING.matcher(window).find()) {
            markerKinds++;
        }
        if (NUMBERED_SECTION.matcher(window).find()) {
            markerKinds++;
        }
        if (REFERENCE_MARKER.matcher(window).find()) {
            markerKinds++;
        }
        double structure = 0.3 + 0.7 * Math.min(1.0, markerKinds / 2.0);

        double typePrior = contentType == null
            ? 0.5
            : CONTENT_TYPE_PRIOR.getOrDefault(contentType.toLowerCase(Locale.ROOT), 0.5);

        return 0.4 * domainPrior + 0.3 * structure + 0.3 * typePrior;
    }

    /**
     * 出现次数最多的信息词，次数相同按字母序
     */
    private List<String> extractKeywords(List<String> tokens) {
        Map<String, Integer> frequency = new HashMap<>();
        for (String token : tokens) {
            if (isInformative(token)) {
                frequency.merge(token, 1, Integer::sum);
            }
        }
        return frequency.entrySet().stream()
            .sorted(Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue).reversed()
                .thenComparing(Map.Entry::getKey))
            .limit(settings.getKeywordCount())
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SPLITTER.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private int countWords(String text) {
        int count = 0;
        boolean inWord = false;
        for (int i = 0; i < text.length(); i++) {
            boolean whitespace = Character.isWhitespace(text.charAt(i));
            if (!whitespace && !inWord) {
                count++;
            }
            inWord = !whitespace;
        }
        return count;
    }

    private boolean isInformative(String token) {
        return token.length() > 2 && !STOP_WORDS.contains(token);
    }

    private double coefficientOfVariation(List<Integer> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double sum = 0.0;
        for (int value : values) {
            sum += value;
        }
        double mean = sum / values.size();
        double squares = 0.0;
        for (int value : values) {
            squares += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(squares / values.size());
        return mean == 0.0 ? 0.0 : std / mean;
    }

    private double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : left) {
            if (right.contains(token)) {
                intersection++;
            }
        }
        int union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }

    private double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
