package com.outreach.scoring.engine.anomaly;

import com.outreach.scoring.config.AnomalyProperties;
import com.outreach.scoring.model.AnomalyFlag;
import com.outreach.scoring.model.AnomalyReport;
import com.outreach.scoring.model.AnomalyType;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnomalyClassifierTest {

    private AnomalyProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AnomalyProperties();
    }

    private static ContactRecord record(String email) {
        return ContactRecord.builder().email(email).build();
    }

    @Test
    void classify_ordinaryAddress_clean() {
        AnomalyReport report = new AnomalyClassifier(properties).classify(record("mario.rossi@rossi-srl.it"));

        assertThat(report.isAnomalous()).isFalse();
        assertThat(report.getType()).isEqualTo(AnomalyType.NONE);
        assertThat(report.getFlags()).isEmpty();
    }

    @Test
    void classify_spamTrap_critical() {
        AnomalyReport report = new AnomalyClassifier(properties).classify(record("postmaster@rossi-srl.it"));

        assertThat(report.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.getType()).isEqualTo(AnomalyType.SPAM_TRAP);
        assertThat(report.getReasons()).containsExactly("Matches spam-trap signature 'role-account-trap'");
    }

    @Test
    void classify_spamTrapConfiguredLow_stillCritical() {
        properties.setPatterns(List.of(new AnomalyProperties.PatternSignature(
                "trap", "^trap@", AnomalyType.SPAM_TRAP, Severity.LOW)));

        AnomalyReport report = new AnomalyClassifier(properties).classify(record("trap@rossi.it"));

        assertThat(report.getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void classify_disposableService_high() {
        AnomalyReport report = new AnomalyClassifier(properties).classify(record("jane@guerrillamail.net"));

        assertThat(report.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(report.getType()).isEqualTo(AnomalyType.DISPOSABLE_DOMAIN);
    }

    @Test
    void classify_qualityFlags_reportedLow() {
        AnomalyReport report = new AnomalyClassifier(properties)
                .classify(record("123456@rossi.it"), List.of("^[0-9]{5,}@"));

        assertThat(report.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(report.getType()).isEqualTo(AnomalyType.QUALITY_PATTERN);
        assertThat(report.getReasons()).containsExactly("Matches configured suspicious pattern '^[0-9]{5,}@'");
    }

    @Test
    void classify_statisticalOutlier_severityByDeviation() {
        properties.setPopulation(List.of(new AnomalyProperties.FeatureStatistics(
                AddressFeature.LOCAL_PART_LENGTH, 9.0, 4.0)));
        AnomalyClassifier classifier = new AnomalyClassifier(properties);

        // z = (26 - 9) / 4 = 4.25: above 3 sigma, below 4.5
        AnomalyReport low = classifier.classify(record("mario.rossi.giuseppe.verdi@rossi.it"));
        assertThat(low.getType()).isEqualTo(AnomalyType.STATISTICAL_OUTLIER);
        assertThat(low.getSeverity()).isEqualTo(Severity.LOW);

        // z = (41 - 9) / 4 = 8: above 6 sigma
        AnomalyReport high = classifier.classify(record("mario.rossi.giuseppe.verdi.anna.maria.bei@rossi.it"));
        assertThat(high.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void classify_domainAge_usedWhenKnown() {
        properties.setPopulation(List.of(new AnomalyProperties.FeatureStatistics(
                AddressFeature.DOMAIN_AGE_DAYS, 3650, 500)));
        AnomalyClassifier classifier = new AnomalyClassifier(properties);

        ContactRecord young = ContactRecord.builder().email("info@rossi.it").domainAgeDays(2).build();

        assertThat(classifier.classify(young).getType()).isEqualTo(AnomalyType.STATISTICAL_OUTLIER);
        assertThat(classifier.classify(record("info@rossi.it")).isAnomalous()).isFalse();
    }

    @Test
    void classify_multipleFlags_highestSeverityWinsAndAllReasonsKept() {
        properties.setPopulation(List.of(new AnomalyProperties.FeatureStatistics(
                AddressFeature.LOCAL_PART_LENGTH, 4.0, 0.5)));

        AnomalyReport report = new AnomalyClassifier(properties)
                .classify(record("webmaster@rossi.it"), List.of("master"));

        assertThat(report.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(report.getFlags()).extracting(AnomalyFlag::getType)
                .containsExactly(AnomalyType.SPAM_TRAP, AnomalyType.QUALITY_PATTERN, AnomalyType.STATISTICAL_OUTLIER);
    }

    @Test
    void classify_sparseNeighborhood_localOutlier() {
        properties.setReferenceAddresses(referenceSample());
        properties.setPopulation(normalPopulation());
        properties.getNeighborDensity().setSensitivity(0.95);

        AnomalyReport report = new AnomalyClassifier(properties).classify(record("12345678.xyz@rossi.it"));

        assertThat(report.getFlags()).anySatisfy(f -> {
            assertThat(f.getType()).isEqualTo(AnomalyType.LOCAL_OUTLIER);
            assertThat(f.getSeverity()).isEqualTo(Severity.HIGH);
        });
    }

    @Test
    void classify_typicalAddressAmongReferences_noDensityFlag() {
        properties.setReferenceAddresses(referenceSample());
        properties.setPopulation(normalPopulation());

        AnomalyReport report = new AnomalyClassifier(properties).classify(record("vendite@rossi.it"));

        assertThat(report.getFlags()).noneMatch(f -> f.getType() == AnomalyType.LOCAL_OUTLIER);
    }

    @Test
    void classify_densityCheckDisabled_noDensityFlag() {
        properties.setReferenceAddresses(referenceSample());
        properties.setPopulation(normalPopulation());
        properties.getNeighborDensity().setEnabled(false);

        AnomalyReport report = new AnomalyClassifier(properties).classify(record("12345678.xyz@rossi.it"));

        assertThat(report.getFlags()).noneMatch(f -> f.getType() == AnomalyType.LOCAL_OUTLIER);
    }

    @Test
    void classify_shippedSettings_ordinaryCorporateAddressesNotFlagged() throws IOException {
        AnomalyClassifier classifier = new AnomalyClassifier(shippedProperties());

        for (String email : List.of("jo@bmw.de", "info@eni.it", "anna.schmidt@bosch.com", "info@siemens.com",
                "sales@abb.com", "m.bianchi@fiat.it", "purchasing@parker.com", "mario.rossi@rossi-srl.it")) {
            AnomalyReport report = classifier.classify(record(email));
            assertThat(report.getSeverity().isAtLeast(Severity.MEDIUM)).as(email).isFalse();
            assertThat(report.getFlags()).as(email).noneMatch(f -> f.getType() == AnomalyType.LOCAL_OUTLIER);
        }
    }

    @Test
    void classify_shippedSettings_generatedAddressIsLocalOutlier() throws IOException {
        AnomalyReport report = new AnomalyClassifier(shippedProperties()).classify(record("12345678.xyz@rossi.it"));

        assertThat(report.getFlags()).anySatisfy(f -> assertThat(f.getType()).isEqualTo(AnomalyType.LOCAL_OUTLIER));
    }

    @Test
    void classify_referenceSampleWithoutSpread_noDensityFlag() {
        properties.setReferenceAddresses(Collections.nCopies(12, "info@rossi.it"));
        properties.setPopulation(normalPopulation());
        properties.getNeighborDensity().setSensitivity(1.0);

        AnomalyReport report = new AnomalyClassifier(properties).classify(record("12345678.xyz@rossi.it"));

        assertThat(report.getFlags()).noneMatch(f -> f.getType() == AnomalyType.LOCAL_OUTLIER);
    }

    @Test
    void percentile_nearestRank() {
        double[] values = {4.0, 1.0, 3.0, 2.0};

        assertThat(ReferencePopulation.percentile(values, 0.5)).isEqualTo(2.0);
        assertThat(ReferencePopulation.percentile(values, 0.95)).isEqualTo(4.0);
        assertThat(ReferencePopulation.percentile(values, 0.0)).isEqualTo(1.0);
        assertThat(ReferencePopulation.percentile(new double[0], 0.95)).isZero();
    }

    @Test
    void construct_invalidSignatureRegex_failsFast() {
        properties.setPatterns(List.of(new AnomalyProperties.PatternSignature(
                "broken", "([a-z", AnomalyType.BOT_GENERATED, Severity.HIGH)));

        assertThatThrownBy(() -> new AnomalyClassifier(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broken");
    }

    private static AnomalyProperties shippedProperties() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        return new Binder(ConfigurationPropertySources.from(sources))
                .bind("anomaly", AnomalyProperties.class)
                .get();
    }

    private static List<String> referenceSample() {
        return List.of("info@rossi.it", "sales@bianchi.it", "office@verdi.com", "mario@ferrari.it",
                "anna@colombo.it", "contact@ricci.com", "export@marino.it", "luca@greco.it",
                "hello@bruno.com", "vendite@gallo.it", "paolo@conti.it", "ufficio@costa.it");
    }

    private static List<AnomalyProperties.FeatureStatistics> normalPopulation() {
        List<AnomalyProperties.FeatureStatistics> population = new ArrayList<>();
        population.add(new AnomalyProperties.FeatureStatistics(AddressFeature.LOCAL_PART_LENGTH, 6.0, 2.0));
        population.add(new AnomalyProperties.FeatureStatistics(AddressFeature.DOMAIN_LENGTH, 10.0, 3.0));
        population.add(new AnomalyProperties.FeatureStatistics(AddressFeature.DIGIT_RATIO, 0.0, 0.1));
        population.add(new AnomalyProperties.FeatureStatistics(AddressFeature.SPECIAL_CHAR_RATIO, 0.0, 0.1));
        return population;
    }
}
