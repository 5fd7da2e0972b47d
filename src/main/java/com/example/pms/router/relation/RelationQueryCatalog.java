package com.example.pms.router.relation;

import com.example.pms.router.model.FkTier;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.model.RelationDomain;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.example.pms.router.model.FkTier.DIRECT;
import static com.example.pms.router.model.FkTier.SAME_CATEGORY;
import static com.example.pms.router.model.FkTier.SAME_PARENT;
import static com.example.pms.router.model.RecordType.CERTIFICATE;
import static com.example.pms.router.model.RecordType.DOCUMENT;
import static com.example.pms.router.model.RecordType.EMAIL;
import static com.example.pms.router.model.RecordType.EQUIPMENT;
import static com.example.pms.router.model.RecordType.FAULT;
import static com.example.pms.router.model.RecordType.MANUAL;
import static com.example.pms.router.model.RecordType.PART;
import static com.example.pms.router.model.RecordType.SHOPPING_ITEM;
import static com.example.pms.router.model.RecordType.WORK_ORDER;
import static com.example.pms.router.model.RelationDomain.CERTIFICATES;
import static com.example.pms.router.model.RelationDomain.DOCUMENTS;
import static com.example.pms.router.model.RelationDomain.EMAILS;
import static com.example.pms.router.model.RelationDomain.FAULTS;
import static com.example.pms.router.model.RelationDomain.HISTORY;
import static com.example.pms.router.model.RelationDomain.INVENTORY;
import static com.example.pms.router.model.RelationDomain.MANUALS;
import static com.example.pms.router.model.RelationDomain.SHOPPING;
import static com.example.pms.router.model.RelationDomain.WORK_ORDERS;

/**
 * The fixed set of foreign-key lookups per focus type. Every statement is bound to the caller's
 * tenant on every table it reads.
 */
public final class RelationQueryCatalog {

    private static final String CLOSED = "('completed', 'closed', 'cancelled')";

    private final Map<RecordType, List<RelationQuery>> byFocus;

    private RelationQueryCatalog(List<RelationQuery> queries) {
        Map<RecordType, List<RelationQuery>> grouped = new EnumMap<>(RecordType.class);
        for (RelationQuery q : queries) {
            requireTenantScoped(q);
            grouped.computeIfAbsent(q.focusType(), k -> new ArrayList<>()).add(q);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        this.byFocus = grouped;
    }

    public static RelationQueryCatalog of(List<RelationQuery> queries) {
        return new RelationQueryCatalog(queries);
    }

    public static RelationQueryCatalog defaults() {
        List<RelationQuery> q = new ArrayList<>();

        // ---------------- focus: equipment ----------------
        q.add(query("equipment.parts", EQUIPMENT, INVENTORY, DIRECT, PART, """
                select p.id as entity_id, p.updated_at as occurred_at, p.embedding
                from parts p
                where p.yacht_id = :tenantId and p.equipment_id = :focusId
                order by p.updated_at desc limit :limit
                """));
        q.add(query("equipment.siblings", EQUIPMENT, INVENTORY, SAME_PARENT, EQUIPMENT, """
                select e.id as entity_id, e.updated_at as occurred_at, e.embedding
                from equipment f
                join equipment e on e.parent_id = f.parent_id and e.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and e.id <> f.id
                order by e.updated_at desc limit :limit
                """));
        q.add(query("equipment.same_category", EQUIPMENT, INVENTORY, SAME_CATEGORY, EQUIPMENT, """
                select e.id as entity_id, e.updated_at as occurred_at, e.embedding
                from equipment f
                join equipment e on e.category = f.category and e.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and e.id <> f.id
                  and e.parent_id is distinct from f.parent_id
                order by e.updated_at desc limit :limit
                """));
        q.add(query("equipment.open_work_orders", EQUIPMENT, WORK_ORDERS, DIRECT, WORK_ORDER, """
                select w.id as entity_id, w.updated_at as occurred_at, w.embedding
                from work_orders w
                where w.yacht_id = :tenantId and w.equipment_id = :focusId
                  and w.status not in %s
                order by w.updated_at desc limit :limit
                """.formatted(CLOSED)));
        q.add(query("equipment.faults", EQUIPMENT, FAULTS, DIRECT, FAULT, """
                select x.id as entity_id, x.detected_at as occurred_at, x.embedding
                from faults x
                where x.yacht_id = :tenantId and x.equipment_id = :focusId
                order by x.detected_at desc limit :limit
                """));
        q.add(query("equipment.sibling_faults", EQUIPMENT, FAULTS, SAME_PARENT, FAULT, """
                select x.id as entity_id, x.detected_at as occurred_at, x.embedding
                from equipment f
                join equipment e on e.parent_id = f.parent_id and e.yacht_id = :tenantId
                join faults x on x.equipment_id = e.id and x.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and e.id <> f.id
                order by x.detected_at desc limit :limit
                """));
        q.add(query("equipment.documents", EQUIPMENT, DOCUMENTS, DIRECT, DOCUMENT, documents("not in ('manual', 'certificate')")));
        q.add(query("equipment.manuals", EQUIPMENT, MANUALS, DIRECT, MANUAL, documents("= 'manual'")));
        q.add(query("equipment.emails", EQUIPMENT, EMAILS, DIRECT, EMAIL, """
                select m.id as entity_id, m.received_at as occurred_at, null as embedding
                from emails m
                where m.yacht_id = :tenantId and m.equipment_id = :focusId
                order by m.received_at desc limit :limit
                """));
        q.add(query("equipment.certificates", EQUIPMENT, CERTIFICATES, DIRECT, CERTIFICATE, documents("= 'certificate'")));
        q.add(query("equipment.history", EQUIPMENT, HISTORY, DIRECT, WORK_ORDER, """
                select w.id as entity_id, w.completed_at as occurred_at, w.embedding
                from work_orders w
                where w.yacht_id = :tenantId and w.equipment_id = :focusId
                  and w.status in %s
                order by w.completed_at desc limit :limit
                """.formatted(CLOSED)));

        // ---------------- focus: fault ----------------
        q.add(query("fault.equipment", FAULT, INVENTORY, DIRECT, EQUIPMENT, """
                select e.id as entity_id, e.updated_at as occurred_at, e.embedding
                from faults f
                join equipment e on e.id = f.equipment_id and e.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId
                limit :limit
                """));
        q.add(query("fault.work_orders", FAULT, WORK_ORDERS, DIRECT, WORK_ORDER, """
                select w.id as entity_id, w.updated_at as occurred_at, w.embedding
                from work_orders w
                where w.yacht_id = :tenantId and w.fault_id = :focusId
                order by w.updated_at desc limit :limit
                """));
        q.add(query("fault.same_equipment", FAULT, FAULTS, SAME_PARENT, FAULT, """
                select x.id as entity_id, x.detected_at as occurred_at, x.embedding
                from faults f
                join faults x on x.equipment_id = f.equipment_id and x.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and x.id <> f.id
                order by x.detected_at desc limit :limit
                """));
        q.add(query("fault.same_code", FAULT, FAULTS, SAME_CATEGORY, FAULT, """
                select x.id as entity_id, x.detected_at as occurred_at, x.embedding
                from faults f
                join faults x on x.fault_code = f.fault_code and x.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and x.id <> f.id
                  and x.equipment_id is distinct from f.equipment_id
                order by x.detected_at desc limit :limit
                """));
        q.add(query("fault.manuals", FAULT, MANUALS, SAME_PARENT, MANUAL, """
                select d.id as entity_id, d.updated_at as occurred_at, d.embedding
                from faults f
                join documents d on d.equipment_id = f.equipment_id and d.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and d.doc_type = 'manual'
                order by d.updated_at desc limit :limit
                """));
        q.add(query("fault.history", FAULT, HISTORY, SAME_PARENT, WORK_ORDER, """
                select w.id as entity_id, w.completed_at as occurred_at, w.embedding
                from faults f
                join work_orders w on w.equipment_id = f.equipment_id and w.yacht_id = :tenantId
                where f.yacht_id = :tenantId and f.id = :focusId and w.status in %s
                order by w.completed_at desc limit :limit
                """.formatted(CLOSED)));

        // ---------------- focus: work order ----------------
        q.add(query("work_order.equipment", WORK_ORDER, INVENTORY, DIRECT, EQUIPMENT, """
                select e.id as entity_id, e.updated_at as occurred_at, e.embedding
                from work_orders w
                join equipment e on e.id = w.equipment_id and e.yacht_id = :tenantId
                where w.yacht_id = :tenantId and w.id = :focusId
                limit :limit
                """));
        q.add(query("work_order.parts", WORK_ORDER, INVENTORY, DIRECT, PART, """
                select p.id as entity_id, p.updated_at as occurred_at, p.embedding
                from work_order_parts wp
                join parts p on p.id = wp.part_id and p.yacht_id = :tenantId
                where wp.yacht_id = :tenantId and wp.work_order_id = :focusId
                order by p.updated_at desc limit :limit
                """));
        q.add(query("work_order.fault", WORK_ORDER, FAULTS, DIRECT, FAULT, """
                select x.id as entity_id, x.detected_at as occurred_at, x.embedding
                from work_orders w
                join faults x on x.id = w.fault_id and x.yacht_id = :tenantId
                where w.yacht_id = :tenantId and w.id = :focusId
                limit :limit
                """));
        q.add(query("work_order.same_equipment", WORK_ORDER, WORK_ORDERS, SAME_PARENT, WORK_ORDER, """
                select o.id as entity_id, o.updated_at as occurred_at, o.embedding
                from work_orders w
                join work_orders o on o.equipment_id = w.equipment_id and o.yacht_id = :tenantId
                where w.yacht_id = :tenantId and w.id = :focusId and o.id <> w.id
                  and o.status not in %s
                order by o.updated_at desc limit :limit
                """.formatted(CLOSED)));
        q.add(query("work_order.shopping", WORK_ORDER, SHOPPING, DIRECT, SHOPPING_ITEM, """
                select s.id as entity_id, s.updated_at as occurred_at, null as embedding
                from shopping_list_items s
                where s.yacht_id = :tenantId and s.work_order_id = :focusId
                order by s.updated_at desc limit :limit
                """));
        q.add(query("work_order.manuals", WORK_ORDER, MANUALS, SAME_PARENT, MANUAL, """
                select d.id as entity_id, d.updated_at as occurred_at, d.embedding
                from work_orders w
                join documents d on d.equipment_id = w.equipment_id and d.yacht_id = :tenantId
                where w.yacht_id = :tenantId and w.id = :focusId and d.doc_type = 'manual'
                order by d.updated_at desc limit :limit
                """));

        // ---------------- focus: part ----------------
        q.add(query("part.equipment", PART, INVENTORY, DIRECT, EQUIPMENT, """
                select e.id as entity_id, e.updated_at as occurred_at, e.embedding
                from parts p
                join equipment e on e.id = p.equipment_id and e.yacht_id = :tenantId
                where p.yacht_id = :tenantId and p.id = :focusId
                limit :limit
                """));
        q.add(query("part.same_category", PART, INVENTORY, SAME_CATEGORY, PART, """
                select o.id as entity_id, o.updated_at as occurred_at, o.embedding
                from parts p
                join parts o on o.category = p.category and o.yacht_id = :tenantId
                where p.yacht_id = :tenantId and p.id = :focusId and o.id <> p.id
                order by o.updated_at desc limit :limit
                """));
        q.add(query("part.work_orders", PART, WORK_ORDERS, DIRECT, WORK_ORDER, """
                select w.id as entity_id, w.updated_at as occurred_at, w.embedding
                from work_order_parts wp
                join work_orders w on w.id = wp.work_order_id and w.yacht_id = :tenantId
                where wp.yacht_id = :tenantId and wp.part_id = :focusId
                order by w.updated_at desc limit :limit
                """));
        q.add(query("part.shopping", PART, SHOPPING, DIRECT, SHOPPING_ITEM, """
                select s.id as entity_id, s.updated_at as occurred_at, null as embedding
                from shopping_list_items s
                where s.yacht_id = :tenantId and s.part_id = :focusId
                order by s.updated_at desc limit :limit
                """));

        return new RelationQueryCatalog(q);
    }

    public List<RelationQuery> forFocus(RecordType focusType) {
        return byFocus.getOrDefault(focusType, List.of());
    }

    public boolean supports(RecordType focusType) {
        return byFocus.containsKey(focusType);
    }

    private static RelationQuery query(String name, RecordType focus, RelationDomain domain, FkTier tier,
                                       RecordType itemType, String sql) {
        return new RelationQuery(name, focus, domain, tier, itemType, sql);
    }

    private static String documents(String docTypeClause) {
        return """
                select d.id as entity_id, d.updated_at as occurred_at, d.embedding
                from documents d
                where d.yacht_id = :tenantId and d.equipment_id = :focusId and d.doc_type %s
                order by d.updated_at desc limit :limit
                """.formatted(docTypeClause);
    }

    private static void requireTenantScoped(RelationQuery q) {
        if (!q.sql().contains("yacht_id = :tenantId") || !q.sql().contains(":focusId")) {
            throw new IllegalStateException("Relation query " + q.name() + " is not bound to tenant and focus");
        }
    }
}
