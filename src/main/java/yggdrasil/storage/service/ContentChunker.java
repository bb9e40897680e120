package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 文本分块服务
 * 按段落、句子、词三级切分，尽量保持语义完整
 */
@Service
public class ContentChunker {

    private static final Logger log = LoggerFactory.getLogger(ContentChunker.class);

    private final int maxChunkSize;

    public ContentChunker(StorageProperties properties) {
        this.maxChunkSize = Math.max(1, properties.getCoordinator().getChunkSize());
    }

    /**
     * 智能文本分段，结果不含空白分块
     */
    public List<String> chunk(String fullText) {
        List<String> resultChunks = new ArrayList<>();
        if (fullText == null || fullText.isBlank()) {
            return resultChunks;
        }
        StringBuilder chunkBuilder = new StringBuilder();

        for (String rawParagraph : splitIntoParagraphs(fullText)) {
            String paragraph = rawParagraph.trim();
            if (paragraph.isEmpty()) {
                continue;
            }
            // 段落超长，需要细分
            if (paragraph.length() > maxChunkSize) {
                flush(chunkBuilder, resultChunks);
                resultChunks.addAll(subdivideOverlongParagraph(paragraph));
            }
            // 追加后会超出限制
            else if (chunkBuilder.length() + paragraph.length() + 2 > maxChunkSize) {
                flush(chunkBuilder, resultChunks);
                chunkBuilder.append(paragraph);
            }
            else {
                if (chunkBuilder.length() > 0) {
                    chunkBuilder.append("\n\n");
                }
                chunkBuilder.append(paragraph);
            }
        }
        flush(chunkBuilder, resultChunks);

        log.debug("文本分块完成，字符数: {}, 片段数: {}", fullText.length(), resultChunks.size());
        return resultChunks;
    }

    private String[] splitIntoParagraphs(String text) {
        return text.split("\n\\s*\n+");
    }

    private List<String> subdivideOverlongParagraph(String paragraph) {
        List<String> subChunks = new ArrayList<>();
        StringBuilder currentChunk = new StringBuilder();

        for (String sentence : splitIntoSentences(paragraph)) {
            if (sentence.length() > maxChunkSize) {
                flush(currentChunk, subChunks);
                subChunks.addAll(subdivideOverlongSentence(sentence));
            } else if (currentChunk.length() + sentence.length() + 1 > maxChunkSize) {
                flush(currentChunk, subChunks);
                currentChunk.append(sentence);
            } else {
                if (currentChunk.length() > 0) {
                    currentChunk.append(' ');
                }
                currentChunk.append(sentence);
            }
        }
        flush(currentChunk, subChunks);
        return subChunks;
    }

    private String[] splitIntoSentences(String paragraph) {
        return paragraph.split("(?<=[。！？；])|(?<=[.!?;])\\s+");
    }

    /**
     * 按空白切词，单词本身超长时按字符硬切
     */
    private List<String> subdivideOverlongSentence(String sentence) {
        List<String> wordChunks = new ArrayList<>();
        StringBuilder wordBuilder = new StringBuilder();

        for (String word : sentence.split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (word.length() > maxChunkSize) {
                flush(wordBuilder, wordChunks);
                for (int position = 0; position < word.length(); position += maxChunkSize) {
                    wordChunks.add(word.substring(position, Math.min(position + maxChunkSize, word.length())));
                }
                continue;
            }
            if (wordBuilder.length() + word.length() + 1 > maxChunkSize) {
                flush(wordBuilder, wordChunks);
            }
            if (wordBuilder.length() > 0) {
                wordBuilder.append(' ');
            }
            wordBuilder.append(word);
        }
        flush(wordBuilder, wordChunks);
        return wordChunks;
    }

    private void flush(StringBuilder builder, List<String> target) {
        if (builder.length() > 0) {
            String chunk = builder.toString().trim();
            if (!chunk.isEmpty()) {
                target.add(chunk);
            }
            builder.setLength(0);
        }
    }
}
