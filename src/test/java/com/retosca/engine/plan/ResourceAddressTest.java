package com.retosca.engine.plan;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ResourceAddressTest {

    @Test
    void testParseSimpleAddress() {
        ResourceAddress address = ResourceAddress.parse("aws_vpc.main");

        assertThat(address.getType()).isEqualTo("aws_vpc");
        assertThat(address.getName()).isEqualTo("main");
        assertThat(address.getKey()).isNull();
        assertThat(address.getModules()).isEmpty();
        assertThat(address.isData()).isFalse();
        assertThat(address.resourceAddress()).isEqualTo("aws_vpc.main");
    }

    @Test
    void testParseNestedModulesWithKeysAndAttribute() {
        ResourceAddress address = ResourceAddress.parse("module.net[\"eu\"].module.az[1].aws_subnet.private[2].cidr_block");

        assertThat(address.moduleNames()).containsExactly("net", "az");
        assertThat(address.modulePath()).isEqualTo("module.net[\"eu\"].module.az[1]");
        assertThat(address.moduleConfigPath()).isEqualTo("module.net.module.az");
        assertThat(address.getIndex()).isEqualTo(2);
        assertThat(address.getAttribute()).isEqualTo("cidr_block");
        assertThat(address.configAddress()).isEqualTo("module.net.module.az.aws_subnet.private");
        assertThat(address.resourceAddress()).isEqualTo("module.net[\"eu\"].module.az[1].aws_subnet.private[2]");
    }

    @Test
    void testStringKeyIsNotAnIndex() {
        ResourceAddress address = ResourceAddress.parse("aws_subnet.this[\"10\"]");

        assertThat(address.getKey().isQuoted()).isTrue();
        assertThat(address.getIndex()).isNull();
        assertThat(address.resourceAddress()).isEqualTo("aws_subnet.this[\"10\"]");
    }

    @Test
    void testDottedStringKeyStaysInOneSegment() {
        ResourceAddress address = ResourceAddress.parse("aws_route53_record.www[\"a.example.com\"]");

        assertThat(address.getKey().getValue()).isEqualTo("a.example.com");
        assertThat(address.getAttribute()).isNull();
    }

    @Test
    void testDataSourceAddress() {
        ResourceAddress address = ResourceAddress.parse("data.aws_ami.ubuntu.id");

        assertThat(address.isData()).isTrue();
        assertThat(address.localName()).isEqualTo("data.aws_ami.ubuntu");
        assertThat(address.getAttribute()).isEqualTo("id");
    }

    @Test
    void testSplatKeyIsDropped() {
        ResourceAddress address = ResourceAddress.parse("aws_subnet.private[*].id");

        assertThat(address.getKey()).isNull();
        assertThat(address.getAttribute()).isEqualTo("id");
    }

    @Test
    void testTryParseRejectsNonAddresses() {
        assertThat(ResourceAddress.tryParse("var")).isNull();
        assertThat(ResourceAddress.tryParse("")).isNull();
        assertThat(ResourceAddress.tryParse(null)).isNull();
        assertThatThrownBy(() -> ResourceAddress.parse("module.only"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
