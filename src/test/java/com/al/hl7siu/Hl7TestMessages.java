package com.al.hl7siu;

/**
 * Sample messages shared by the tests.
 */
public final class Hl7TestMessages {

    private Hl7TestMessages() {
    }

    public static final String VALID_SIU =
            "MSH|^~\\&|SEND|FAC|RECV|FAC|20250101120000+0600||SIU^S12|MSG0001|P|2.3\r"
            + "SCH|123456|FILL123||||||^General Consultation|||^^^20250502130000+0600\r"
            + "PID|1||P12345^^^HOSP^MR||Doe^John||19850210|M\r"
            + "PV1|1|O|ClinicA^203^^MainFacility|||D67890^Smith^Jane^^^Dr\r";

    public static final String WRONG_TYPE =
            "MSH|^~\\&|SEND|FAC|RECV|FAC|20250101120000+0600||ADT^A01|MSG0002|P|2.3\r";

    public static final String MISSING_SCH =
            "MSH|^~\\&|SEND|FAC|RECV|FAC|20250101120000+0600||SIU^S12|MSG0003|P|2.3\r"
            + "PID|1||P12345^^^HOSP^MR||Doe^John||19850210|M\r";

    public static final String NO_PV1 =
            "MSH|^~\\&|SEND|FAC|RECV|FAC|20250101120000+0600||SIU^S12|MSG0004|P|2.3\r"
            + "SCH|123456|FILL123||||||^General Consultation|||^^^20250502130000+0600\r"
            + "PID|1||P12345^^^HOSP^MR||Doe^John||19850210|M\r";
}
