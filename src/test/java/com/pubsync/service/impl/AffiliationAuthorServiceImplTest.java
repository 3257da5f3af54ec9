package com.pubsync.service.impl;

import com.pubsync.model.vo.ExtractedAuthorsVO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("本机构作者提取")
class AffiliationAuthorServiceImplTest {

    private static final List<String> KEYWORDS = List.of("Khazar University", "Khazar", "Xəzər Universiteti");

    private final AffiliationAuthorServiceImpl service = new AffiliationAuthorServiceImpl();

    @Test
    @DisplayName("命中关键词的作者块生成短名并附加 ID")
    void singleAffiliatedAuthor() {
        ExtractedAuthorsVO result = service.extract(
                "Smith, John, Khazar University, Baku, Azerbaijan",
                "Smith, John (12345)",
                List.of("Khazar"));

        assertThat(result.getCount()).isEqualTo(1);
        assertThat(result.getAuthorsShort()).isEqualTo("Smith, J.");
        assertThat(result.getAuthorsWithIds()).isEqualTo("Smith, John (12345)");
        assertThat(result.getAuthorsFull()).isEqualTo("Smith, John");
    }

    @Test
    @DisplayName("只保留本机构作者,顺序与作者块一致")
    void mixedAffiliations() {
        ExtractedAuthorsVO result = service.extract(
                "Smith, John, Khazar University, Baku; Doe, Jane, MIT, Cambridge; Aliyev, Rashad, Xəzər Universiteti, Bakı",
                "Smith, John (111); Doe, Jane (222); Aliyev, Rashad (333)",
                KEYWORDS);

        assertThat(result.getShortNames()).containsExactly("Smith, J.", "Aliyev, R.");
        assertThat(result.getFullNamesWithIds()).containsExactly("Smith, John (111)", "Aliyev, Rashad (333)");
        assertThat(result.getFullNames()).containsExactly("Smith, John", "Aliyev, Rashad");
    }

    @Test
    @DisplayName("关键词匹配大小写不敏感")
    void caseInsensitiveKeyword() {
        ExtractedAuthorsVO result = service.extract(
                "Mammadov, Elvin, KHAZAR UNIVERSITY, Baku", null, List.of("khazar"));

        assertThat(result.getShortNames()).containsExactly("Mammadov, E.");
    }

    @Test
    @DisplayName("三个列表长度一致")
    void listsAligned() {
        ExtractedAuthorsVO result = service.extract(
                "A, Bob, Khazar; C, Dan, Khazar; E, Fay, Other; G, Hal, Khazar",
                "A, Bob (1); G, Hal (bad)",
                KEYWORDS);

        assertThat(result.getShortNames()).hasSize(3);
        assertThat(result.getFullNamesWithIds()).hasSize(3);
        assertThat(result.getFullNames()).hasSize(3);
    }

    @Nested
    @DisplayName("全名查找")
    class FullNameLookup {

        @Test
        @DisplayName("全名中无此人时回退为 \"Last, First\"")
        void fallbackWithoutId() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, John, Khazar University", "Doe, Jane (222)", KEYWORDS);

            assertThat(result.getAuthorsWithIds()).isEqualTo("Smith, John");
            assertThat(result.getAuthorsFull()).isEqualTo("Smith, John");
        }

        @Test
        @DisplayName("ID 非数字的全名条目被忽略")
        void malformedIdIgnored() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, John, Khazar University", "Smith, John (abc)", KEYWORDS);

            assertThat(result.getAuthorsWithIds()).isEqualTo("Smith, John");
        }

        @Test
        @DisplayName("全名为空时全部回退")
        void emptyFullNames() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, John, Khazar University", "", KEYWORDS);

            assertThat(result.getCount()).isEqualTo(1);
            assertThat(result.getAuthorsWithIds()).isEqualTo("Smith, John");
        }

        @Test
        @DisplayName("同姓作者按名字区分")
        void sameLastNameExactFirstName() {
            ExtractedAuthorsVO result = service.extract(
                    "Aliyev, Ramil, Khazar University",
                    "Aliyev, Rashad (1); Aliyev, Ramil (2)",
                    KEYWORDS);

            assertThat(result.getAuthorsWithIds()).isEqualTo("Aliyev, Ramil (2)");
            assertThat(result.getAmbiguousAuthors()).isEmpty();
        }

        @Test
        @DisplayName("同姓作者按首字母区分")
        void sameLastNameInitial() {
            ExtractedAuthorsVO result = service.extract(
                    "Aliyev, T., Khazar University",
                    "Aliyev, Rashad (1); Aliyev, Tural (2)",
                    KEYWORDS);

            assertThat(result.getAuthorsWithIds()).isEqualTo("Aliyev, Tural (2)");
            assertThat(result.getAuthorsFull()).isEqualTo("Aliyev, Tural");
        }

        @Test
        @DisplayName("同姓同首字母时不附加 ID 并标记为歧义")
        void ambiguousNotGuessed() {
            ExtractedAuthorsVO result = service.extract(
                    "Aliyev, R., Khazar University",
                    "Aliyev, Rashad (1); Aliyev, Ramil (2)",
                    KEYWORDS);

            assertThat(result.getShortNames()).containsExactly("Aliyev, R.");
            assertThat(result.getAuthorsWithIds()).isEqualTo("Aliyev, R.");
            assertThat(result.getAmbiguousAuthors()).containsExactly("Aliyev, R.");
        }

        @Test
        @DisplayName("同一作者重复列出时不视为歧义")
        void duplicateFullNameEntries() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, J., Khazar University",
                    "Smith, John (12345); Smith, John (12345)",
                    KEYWORDS);

            assertThat(result.getAuthorsWithIds()).isEqualTo("Smith, John (12345)");
            assertThat(result.getAmbiguousAuthors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("边界情况")
    class EdgeCases {

        @Test
        @DisplayName("作者机构为空时返回空结果")
        void emptyAffiliations() {
            assertThat(service.extract("", "Smith, John (1)", KEYWORDS).getCount()).isZero();
            assertThat(service.extract(null, "Smith, John (1)", KEYWORDS).getCount()).isZero();
        }

        @Test
        @DisplayName("关键词为空时返回空结果")
        void emptyKeywords() {
            assertThat(service.extract("Smith, John, Khazar University", null, List.of()).getCount()).isZero();
            assertThat(service.extract("Smith, John, Khazar University", null, null).getCount()).isZero();
            assertThat(service.extract("Smith, John, Khazar University", null, List.of(" ")).getCount()).isZero();
        }

        @Test
        @DisplayName("没有逗号的作者块被跳过")
        void blockWithoutName() {
            ExtractedAuthorsVO result = service.extract(
                    "Khazar University; Smith, John, Khazar University", null, KEYWORDS);

            assertThat(result.getShortNames()).containsExactly("Smith, J.");
        }

        @Test
        @DisplayName("名字为空时短名为 \"Last, \"")
        void emptyFirstName() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, , Khazar University", null, KEYWORDS);

            assertThat(result.getShortNames()).containsExactly("Smith, ");
        }

        @Test
        @DisplayName("空作者块被跳过")
        void emptyBlocks() {
            ExtractedAuthorsVO result = service.extract(
                    ";; Smith, John, Khazar University ;", null, KEYWORDS);

            assertThat(result.getCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("命中排除关键词的作者块不计入")
        void excludeKeywords() {
            ExtractedAuthorsVO result = service.extract(
                    "Smith, John, Khazar University, Baku; Doe, Jane, Khazar Institute of Oil, Baku",
                    null,
                    List.of("Khazar"),
                    List.of("Institute of Oil"));

            assertThat(result.getShortNames()).containsExactly("Smith, J.");
        }
    }
}
