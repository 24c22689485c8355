package eu.virtualparadox.retrieval.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tokenization settings: when to call the Thai segmenter and which query words to ignore.
 */
@Configuration
@ConfigurationProperties(prefix = "retrieval.text")
@Getter @Setter
public class TextConfig {

    /** Share of Thai characters above which query text is segmented first. */
    private double thaiDensityThreshold = 0.10;

    /** Upper bound for a single segmenter call; on expiry the unsegmented text is used. */
    private Duration segmenterTimeout = Duration.ofSeconds(3);

    /** Words dropped from query terms (never from chunk text). */
    private List<String> stopWords = new ArrayList<>(List.of(
            // English
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "must", "can", "this", "that", "these", "those",
            // Thai
            "ที่", "และ", "หรือ", "แต่", "ใน", "บน", "เพื่อ", "ของ", "กับ", "โดย", "ได้",
            "เป็น", "มี", "จาก", "ไป", "มา", "ก็", "จะ", "ถึง", "ให้", "ยัง", "คือ", "ว่า",
            "นี้", "นั้น", "นะ", "ครับ", "ค่ะ", "คะ", "ไหม", "มั้ย", "อะไร", "เมื่อไหร่", "ที่ไหน",
            "ทำไม", "อย่างไร", "ใคร", "ขอ", "ช่วย", "บอก", "ดู", "อยู่", "เอา", "ลอง",
            "หา", "ต้อง", "อยาก", "ไม่", "ไม่ได้", "ไม่มี", "แล้ว", "เลย", "เดี๋ยว", "เอง"));
}
