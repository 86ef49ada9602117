package tollgate;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import com.tngtech.archunit.lang.syntax.ArchRuleDefinition;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@DisplayName("Hexagonal Architecture Rules")
class HexagonalArchitectureTest {

    private static JavaClasses importedClasses;

    @BeforeAll
    static void setUp() {
        importedClasses = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("tollgate");
    }

    @Nested
    @DisplayName("Core Layer Rules")
    class CoreLayerRules {

        @Test
        @DisplayName("Core should not depend on adapter")
        void coreShouldNotDependOnAdapter() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.adapter..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on system")
        void coreShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Core should not depend on JAX-RS")
        void coreShouldNotDependOnJaxRs() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core..")
                    .should().dependOnClassesThat().resideInAPackage("jakarta.ws.rs..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Adapter Layer Rules")
    class AdapterLayerRules {

        @Test
        @DisplayName("Adapter should not depend on system")
        void adapterShouldNotDependOnSystem() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.adapter..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Outbound adapters should not depend on inbound adapters")
        void outboundShouldNotDependOnInbound() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.adapter.out..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.adapter.in..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("SPI Rules")
    class SpiRules {

        @Test
        @DisplayName("SPI should not depend on adapter or system")
        void spiShouldNotDependOnImplementations() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.spi..")
                    .should().dependOnClassesThat().resideInAnyPackage("tollgate.adapter..", "tollgate.system..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("SPI should not depend on CDI or Quarkus")
        void spiShouldStayFrameworkFree() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.spi..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.quarkus..", "jakarta.enterprise..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Port Interface Rules")
    class PortInterfaceRules {

        @Test
        @DisplayName("Outbound ports should only contain interfaces")
        void outboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("tollgate.core.port.out..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Inbound ports should only contain interfaces")
        void inboundPortsShouldBeInterfaces() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("tollgate.core.port.in..")
                    .should().beInterfaces();

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Model Rules")
    class ModelRules {

        @Test
        @DisplayName("Models should not depend on services")
        void modelsShouldNotDependOnServices() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.core.service..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on ports")
        void modelsShouldNotDependOnPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core.model..")
                    .should().dependOnClassesThat().resideInAPackage("tollgate.core.port..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Models should not depend on Quarkus, Mutiny, or Jakarta")
        void modelsShouldBePlainJava() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.core.model..")
                    .should().dependOnClassesThat().resideInAnyPackage("io.quarkus..", "io.smallrye..", "jakarta..");

            rule.check(importedClasses);
        }
    }

    @Nested
    @DisplayName("Metering Pipeline Rules")
    class MeteringPipelineRules {

        @Test
        @DisplayName("Pipeline should reach counters and usage storage only through inbound ports")
        void pipelineShouldNotUseOutboundPorts() {
            ArchRule rule = noClasses()
                    .that().resideInAPackage("tollgate.system..")
                    .should().dependOnClassesThat().resideInAnyPackage(
                            "tollgate.core.port.out..", "tollgate.adapter.out.counter..", "tollgate.adapter.out.storage..");

            rule.check(importedClasses);
        }

        @Test
        @DisplayName("Stages should implement MeteringStage")
        void stagesShouldImplementMeteringStage() {
            ArchRule rule = ArchRuleDefinition.classes()
                    .that().resideInAPackage("tollgate.system.pipeline..")
                    .and().haveSimpleNameEndingWith("Stage")
                    .and().areNotInterfaces()
                    .should().implement("tollgate.system.pipeline.MeteringStage");

            rule.check(importedClasses);
        }
    }
}
