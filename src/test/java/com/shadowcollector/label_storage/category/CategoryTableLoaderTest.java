package com.shadowcollector.label_storage.category;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shadowcollector.label_storage.types.CategoryInfo;
import com.shadowcollector.label_storage.types.TableLoadResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CategoryTableLoaderTest {

    private CategoryTableLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CategoryTableLoader(new ObjectMapper());
    }

    @Test
    void loadsClassesCsvFixture() {
        TableLoadResult<CategoryTable> result = loader.loadCategoryTable(new ClassPathResource("classes.csv"));

        assertThat(result.isLoaded()).isTrue();
        CategoryTable table = result.getTable().orElseThrow();
        assertThat(table.size()).isEqualTo(7);
        assertThat(table.lookup("021_gt_hd_xs")).contains(new CategoryInfo("设备-输电", "杆塔"));
        assertThat(table.lookup("011_aj_aqm_wpd")).contains(new CategoryInfo("安监", "人员"));
    }

    @Test
    void skipsShortRowsAndRowsWithEmptyCells() {
        CategoryTable table = loader.loadCategoryTable(new ClassPathResource("classes.csv")).getTable().orElseThrow();

        assertThat(table.lookup("099_missing_category1")).isEmpty();
        assertThat(table.lookup("041_missing_category2")).isEmpty();
        assertThat(table.asMap().keySet()).doesNotContain("破损");
    }

    @Test
    void laterDuplicateOverwritesEarlierRow() {
        CategoryTable table = loader.loadCategoryTable(new ClassPathResource("classes.csv")).getTable().orElseThrow();

        assertThat(table.lookup("022_bd_zb_sy")).contains(new CategoryInfo("设备-变电", "主变压器"));
    }

    @Test
    void stripsByteOrderMarkFromFirstCell() {
        String csv = "header,a,b,c,d\n\uFEFF安监,人员,x,y,011_bom_label\n";

        CategoryTable table = CategoryTableLoader.parseCategoryCsv(csv);

        assertThat(table.lookup("011_bom_label")).contains(new CategoryInfo("安监", "人员"));
    }

    @Test
    void headerOnlyOrEmptyContentYieldsEmptyTable() {
        assertThat(CategoryTableLoader.parseCategoryCsv("专业,部件,部位,状态,标签\n").size()).isZero();
        assertThat(CategoryTableLoader.parseCategoryCsv("").size()).isZero();
        assertThat(CategoryTableLoader.parseCategoryCsv(null).size()).isZero();
    }

    @Test
    void missingCategorySourceIsReportedNotThrown() {
        TableLoadResult<CategoryTable> result = loader.loadCategoryTable(new ClassPathResource("no-such-classes.csv"));

        assertThat(result.isLoaded()).isFalse();
        assertThat(result.getStatus()).isEqualTo(TableLoadResult.Status.MISSING);
        assertThat(result.getTable()).isEmpty();
    }

    @Test
    void loadsLabelIdFixtureSkippingInvalidEntries() {
        TableLoadResult<LabelIdTable> result = loader.loadLabelIdTable(new ClassPathResource("label-id-map.json"));

        assertThat(result.isLoaded()).isTrue();
        LabelIdTable table = result.getTable().orElseThrow();
        assertThat(table.size()).isEqualTo(4);
        assertThat(table.labelFor(4)).contains("021_gt_hd_xs");
        assertThat(table.labelFor(9)).isEmpty();
        assertThat(table.labelsFor(List.of(4, 999999, 5))).containsExactly("021_gt_hd_xs", "021_gt_hd_wx");
        assertThat(table.labelsFor(List.of())).isEmpty();
    }

    @Test
    void nonObjectLabelIdSourceIsMalformed() {
        ByteArrayResource resource = new ByteArrayResource("[\"021_gt_hd_xs\"]".getBytes(StandardCharsets.UTF_8));

        TableLoadResult<LabelIdTable> result = loader.loadLabelIdTable(resource);

        assertThat(result.getStatus()).isEqualTo(TableLoadResult.Status.MALFORMED);
        assertThat(result.getErrorMessage()).isPresent();
    }

    @Test
    void invalidJsonLabelIdSourceIsMalformed() {
        ByteArrayResource resource = new ByteArrayResource("{not json".getBytes(StandardCharsets.UTF_8));

        assertThat(loader.loadLabelIdTable(resource).getStatus()).isEqualTo(TableLoadResult.Status.MALFORMED);
    }
}
