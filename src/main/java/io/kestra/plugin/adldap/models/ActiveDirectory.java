package io.kestra.plugin.adldap.models;

/**
 * Active Directory attribute names and well-known values, lower-cased as entries expose them.
 */
public final class ActiveDirectory {
    private ActiveDirectory() {
    }

    public static final String ANR = "anr";
    public static final String COMMON_NAME = "cn";
    public static final String NAME = "name";
    public static final String DESCRIPTION = "description";
    public static final String DISPLAY_NAME = "displayname";
    public static final String DISTINGUISHED_NAME = "distinguishedname";
    public static final String OBJECT_CLASS = "objectclass";
    public static final String OBJECT_CATEGORY = "objectcategory";
    public static final String OBJECT_SID = "objectsid";
    public static final String DEFAULT_NAMING_CONTEXT = "defaultnamingcontext";

    public static final String ACCOUNT_NAME = "samaccountname";
    public static final String ACCOUNT_TYPE = "samaccounttype";
    public static final String USER_PRINCIPAL_NAME = "userprincipalname";
    public static final String USER_ACCOUNT_CONTROL = "useraccountcontrol";
    public static final String PRIMARY_GROUP_ID = "primarygroupid";
    public static final String FIRST_NAME = "givenname";
    public static final String LAST_NAME = "sn";
    public static final String EMAIL = "mail";
    public static final String TITLE = "title";
    public static final String DEPARTMENT = "department";
    public static final String TELEPHONE = "telephonenumber";

    public static final String MEMBER = "member";
    public static final String MEMBER_OF = "memberof";
    public static final String GROUP_TYPE = "grouptype";

    public static final String OPERATING_SYSTEM = "operatingsystem";
    public static final String OPERATING_SYSTEM_VERSION = "operatingsystemversion";
    public static final String DNS_HOST_NAME = "dnshostname";

    public static final String PRINTER_NAME = "printername";
    public static final String PRINTER_LOCATION = "location";
    public static final String PRINTER_SERVER_NAME = "servername";
    public static final String PRINTER_DRIVER_NAME = "drivername";

    public static final String SERIAL_NUMBER = "serialnumber";

    public static final String OBJECT_CATEGORY_COMPUTER = "computer";
    public static final String OBJECT_CATEGORY_PERSON = "person";
    public static final String OBJECT_CATEGORY_GROUP = "group";
    public static final String OBJECT_CATEGORY_CONTAINER = "container";
    public static final String OBJECT_CATEGORY_PRINTER = "print-queue";
    public static final String OBJECT_CATEGORY_EXCHANGE_SERVER = "ms-exch-exchange-server";

    public static final String OBJECT_CLASS_GROUP = "Group";

    /** {@code sAMAccountType} of security groups. */
    public static final String SECURITY_GROUP = "268435456";

    /** {@code sAMAccountType} of distribution groups. */
    public static final String DISTRIBUTION_GROUP = "268435457";

    /** {@code userAccountControl} flag of disabled accounts. */
    public static final int ACCOUNT_DISABLED = 0x2;
}
