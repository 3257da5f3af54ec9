package com.pubsync.service.impl;

import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.enums.HighlightReason;
import com.pubsync.model.vo.DepartmentResolutionVO;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("作者院系匹配")
class DepartmentResolveServiceImplTest {

    private final DepartmentResolveServiceImpl service = new DepartmentResolveServiceImpl();

    private static DepartmentMappingDTO row(String author, String department) {
        return DepartmentMappingDTO.builder().authorName(author).department(department).build();
    }

    @Test
    @DisplayName("对照表中没有作者时标记为未匹配")
    void notFound() {
        DepartmentResolutionVO result = service.resolve("Smith, J.", List.of());

        assertThat(result.getDepartment()).isEmpty();
        assertThat(result.getReason()).isEqualTo(HighlightReason.NOT_FOUND);
        assertThat(result.isNeedsHighlight()).isTrue();
        assertThat(result.getNotFoundAuthors()).containsExactly("Smith, J.");
    }

    @Test
    @DisplayName("同一作者对应多个院系时标记为多院系")
    void multipleDepartments() {
        DepartmentResolutionVO result = service.resolve("Smith, J.", List.of(
                row("Smith, J.", "Computer Science"),
                row("Smith, J.", "Mathematics")));

        assertThat(result.getDepartment()).isEqualTo("Computer Science; Mathematics");
        assertThat(result.getReason()).isEqualTo(HighlightReason.MULTIPLE);
        assertThat(result.isNeedsHighlight()).isTrue();
    }

    @Test
    @DisplayName("所有作者属于同一院系时不高亮,院系去重")
    void singleDepartment() {
        DepartmentResolutionVO result = service.resolve("Smith, J.; Doe, A.", List.of(
                row("Smith, J.", "Computer Science"),
                row("Doe, A.", " Computer Science ")));

        assertThat(result.getDepartment()).isEqualTo("Computer Science");
        assertThat(result.getReason()).isEqualTo(HighlightReason.NONE);
        assertThat(result.isNeedsHighlight()).isFalse();
    }

    @Test
    @DisplayName("未匹配优先于多院系")
    void notFoundTakesPrecedence() {
        DepartmentResolutionVO result = service.resolve("Smith, J.; Doe, A.", List.of(
                row("Smith, J.", "Computer Science"),
                row("Smith, J.", "Mathematics")));

        assertThat(result.getReason()).isEqualTo(HighlightReason.NOT_FOUND);
        assertThat(result.getDepartment()).isEqualTo("Computer Science; Mathematics");
        assertThat(result.getNotFoundAuthors()).containsExactly("Doe, A.");
    }

    @Test
    @DisplayName("作者名匹配大小写不敏感")
    void caseInsensitive() {
        DepartmentResolutionVO result = service.resolve("SMITH, J.", List.of(row("smith, j.", "Physics")));

        assertThat(result.getDepartment()).isEqualTo("Physics");
        assertThat(result.getReason()).isEqualTo(HighlightReason.NONE);
    }

    @Test
    @DisplayName("院系为空的对照行算作已找到但不贡献院系")
    void blankDepartment() {
        DepartmentResolutionVO result = service.resolve("Smith, J.", List.of(row("Smith, J.", "  ")));

        assertThat(result.getDepartment()).isEmpty();
        assertThat(result.getReason()).isEqualTo(HighlightReason.NONE);
    }

    @Test
    @DisplayName("作者为空时返回空结果且不高亮")
    void blankAuthors() {
        DepartmentResolutionVO result = service.resolve("  ", List.of(row("Smith, J.", "Physics")));

        assertThat(result.getDepartment()).isEmpty();
        assertThat(result.getReason()).isEqualTo(HighlightReason.NONE);
        assertThat(service.resolve(null, null).isNeedsHighlight()).isFalse();
    }

    @Test
    @DisplayName("高亮原因与对照表行顺序无关")
    void reasonIndependentOfRowOrder() {
        List<DepartmentMappingDTO> mapping = new ArrayList<>(List.of(
                row("Smith, J.", "Computer Science"),
                row("Doe, A.", "Mathematics"),
                row("Aliyev, R.", "Computer Science")));

        HighlightReason forward = service.resolve("Smith, J.; Doe, A.; Aliyev, R.", mapping).getReason();
        Collections.reverse(mapping);
        HighlightReason reversed = service.resolve("Smith, J.; Doe, A.; Aliyev, R.", mapping).getReason();

        assertThat(forward).isEqualTo(HighlightReason.MULTIPLE);
        assertThat(reversed).isEqualTo(forward);
    }
}
