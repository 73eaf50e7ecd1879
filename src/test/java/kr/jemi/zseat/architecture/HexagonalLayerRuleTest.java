package kr.jemi.zseat.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "kr.jemi.zseat", importOptions = ImportOption.DoNotIncludeTests.class)
class HexagonalLayerRuleTest {

    @ArchTest
    static final ArchRule domain은_아무_의존도_없다 =
        noClasses()
            .that().resideInAPackage("..domain..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..application..", "..infrastructure..", "..api.."
            );

    @ArchTest
    static final ArchRule domain은_Spring에_의존하지_않는다 =
        noClasses()
            .that().resideInAPackage("..domain..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("org.springframework..");

    @ArchTest
    static final ArchRule port_in은_domain에게만_의존한다 =
        noClasses()
            .that().resideInAPackage("..application.port.in..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..application.port.out..", "..application.service..", "..infrastructure..", "..api.."
            );

    @ArchTest
    static final ArchRule port_out은_domain에게만_의존한다 =
        noClasses()
            .that().resideInAPackage("..application.port.out..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..application.port.in..", "..application.service..", "..infrastructure..", "..api.."
            );

    @ArchTest
    static final ArchRule application_service는_domain과_port와_api에만_의존한다 =
        noClasses()
            .that().resideInAPackage("..application.service..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..infrastructure.."
            );

    // 이벤트 리스너는 다른 모듈이 발행한 api 이벤트를 받아야 하므로 api 의존은 허용
    @ArchTest
    static final ArchRule infrastructure_in은_domain과_port_in에만_의존한다 =
        noClasses()
            .that().resideInAPackage("..infrastructure.in..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..application.port.out..", "..application.service..", "..infrastructure.out.."
            );

    @ArchTest
    static final ArchRule infrastructure_out은_domain과_port_out과_api에만_의존한다 =
        noClasses()
            .that().resideInAPackage("..infrastructure.out..")
            .should().dependOnClassesThat()
            .resideInAnyPackage(
                "..application.port.in..", "..application.service..", "..infrastructure.in.."
            );

    // application은 다른 모듈의 api에 직접 의존하면 안 된다 (port out → infrastructure out을 통해 접근)
    @ArchTest
    static final ArchRule event_application은_외부_모듈_api에_직접_의존하지_않는다 =
        noClasses()
            .that().resideInAPackage("..event.application..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..seat.api..", "..booking.api..");

    @ArchTest
    static final ArchRule booking_application은_외부_모듈_api에_직접_의존하지_않는다 =
        noClasses()
            .that().resideInAPackage("..booking.application..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..seat.api..", "..event.api..");

    @ArchTest
    static final ArchRule notification_application은_외부_모듈_api에_직접_의존하지_않는다 =
        noClasses()
            .that().resideInAPackage("..notification.application..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..booking.api..", "..event.api..", "..seat.api..");

    @ArchTest
    static final ArchRule seat는_다른_업무_모듈에_의존하지_않는다 =
        noClasses()
            .that().resideInAPackage("kr.jemi.zseat.seat..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("kr.jemi.zseat.event..", "kr.jemi.zseat.booking..", "kr.jemi.zseat.notification..");
}
