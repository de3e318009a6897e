package com.afsun.omop2graph.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 测试用的小型词表导出目录
 */
public final class VocabularyFixtures {

    public static final String DOMAIN_CSV = "domain_id,domain_name,domain_concept_id\n"
            + "Drug,Drug,13\n"
            + "Condition,Condition,19\n";

    public static final String VOCABULARY_CSV = "vocabulary_id,vocabulary_name,vocabulary_reference,vocabulary_version,vocabulary_concept_id\n"
            + "RxNorm,RxNorm,NLM,2024-01,44819104\n"
            + "SNOMED,SNOMED CT,IHTSDO,2024-03,44819097\n";

    public static final String CONCEPT_CSV = "concept_id,concept_name,domain_id,vocabulary_id,concept_class_id,standard_concept,concept_code,valid_start_date,valid_end_date,invalid_reason\n"
            + "1,Aspirin,Drug,RxNorm,Ingredient,S,1191,19700101,20991231,\n"
            + "2,Headache,Condition,SNOMED,Clinical Finding,,25064002,19700101,20991231,\n";

    public static final String RELATIONSHIP_CSV = "concept_id_1,concept_id_2,relationship_id,valid_start_date,valid_end_date,invalid_reason\n"
            + "1,2,Treats,19700101,20991231,\n";

    public static final String ANCESTOR_CSV = "ancestor_concept_id,descendant_concept_id,min_levels_of_separation,max_levels_of_separation\n"
            + "1,1,0,0\n";

    private VocabularyFixtures() {
    }

    public static Path write(Path dir) throws IOException {
        return write(dir, CONCEPT_CSV, RELATIONSHIP_CSV);
    }

    public static Path write(Path dir, String concepts, String relationships) throws IOException {
        Files.createDirectories(dir);
        write(dir.resolve("domain.csv"), DOMAIN_CSV);
        write(dir.resolve("vocabulary.csv"), VOCABULARY_CSV);
        write(dir.resolve("concept.csv"), concepts);
        write(dir.resolve("concept_relationship.csv"), relationships);
        write(dir.resolve("concept_ancestor.csv"), ANCESTOR_CSV);
        return dir;
    }

    public static void write(Path file, String content) throws IOException {
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }
}
