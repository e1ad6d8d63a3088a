package org.example.dxf.db;

import org.example.dxf.DuplicateHandleException;
import org.example.dxf.ProtectedEntityException;
import org.example.dxf.entity.DictionaryObject;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.EntityContainer;
import org.example.dxf.schema.HandleReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一个文档的实体数据库：句柄 -> 实体。
 * <p>
 * 实体之间的关系（所有者、指针）一律保存为句柄，通过 {@link #resolve(String)} 按需解析；
 * 因此允许前向引用，删除实体后残留的软引用只会解析为空。
 * <p>
 * 非线程安全：一个文档的加载/修改/保存由同一线程完成。
 */
public class EntityDatabase {

    private static final Logger log = LoggerFactory.getLogger(EntityDatabase.class);

    private final Map<String, DxfEntity> entities = new LinkedHashMap<>();
    private final HandleGenerator handles;

    public EntityDatabase() {
        this(new HandleGenerator());
    }

    public EntityDatabase(HandleGenerator handles) {
        this.handles = handles;
    }

    public HandleGenerator handles() {
        return handles;
    }

    /**
     * 注册实体：没有句柄时分配新句柄。
     *
     * @return 实体的句柄
     * @throws DuplicateHandleException 句柄已被其他实体占用
     */
    public String register(DxfEntity entity) {
        String handle = entity.handle();
        if (handle == null) {
            do {
                handle = handles.next();
            } while (entities.containsKey(handle));
            entity.assignHandle(handle);
        } else {
            DxfEntity existing = entities.get(key(handle));
            if (existing == entity) {
                return handle;
            }
            if (existing != null) {
                throw new DuplicateHandleException(handle);
            }
            handles.observe(handle);
        }
        entities.put(key(handle), entity);
        return handle;
    }

    public Optional<DxfEntity> resolve(String handle) {
        if (handle == null || handle.isEmpty() || "0".equals(handle)) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(key(handle)));
    }

    public boolean contains(String handle) {
        return resolve(handle).isPresent();
    }

    public int size() {
        return entities.size();
    }

    /**
     * @return 全部实体（按注册顺序，只读视图）
     */
    public Collection<DxfEntity> entities() {
        return Collections.unmodifiableCollection(entities.values());
    }

    /**
     * 设置唯一的所有者，覆盖之前的所有者。不校验所有者是否已存在（允许前向引用）。
     */
    public void setOwner(DxfEntity entity, String ownerHandle) {
        String previous = entity.owner();
        entity.setOwner(ownerHandle);
        if (previous != null && !previous.equalsIgnoreCase(ownerHandle)) {
            log.debug("{} 的所有者由 #{} 改为 #{}", entity, previous, ownerHandle);
        }
    }

    /**
     * @return 以硬指针/硬所有者方式引用 {@code handle} 的存活实体
     */
    public List<DxfEntity> referrers(String handle) {
        List<DxfEntity> result = new ArrayList<>();
        for (DxfEntity e : entities.values()) {
            if (!handle.equalsIgnoreCase(e.handle()) && hasHardReference(e, handle)) {
                result.add(e);
            }
        }
        return result;
    }

    private static boolean hasHardReference(DxfEntity from, String handle) {
        for (HandleReference ref : from.references()) {
            if (ref.kind().isHard() && ref.handle().equalsIgnoreCase(handle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 删除实体及其子实体（VERTEX/ATTRIB/SEQEND、块内容）与扩展字典。
     * <p>
     * 被删除集合之外的存活实体仍以硬引用指向集合中任一实体时拒绝删除（实体自己的所有者除外，
     * 所有者会在删除时解除关联）。删除后残留的软引用解析为空。
     *
     * @throws ProtectedEntityException 仍有硬引用
     */
    public void purge(DxfEntity entity) {
        Set<DxfEntity> doomed = new LinkedHashSet<>();
        collect(entity, doomed);
        Set<String> doomedHandles = new LinkedHashSet<>();
        doomed.forEach(e -> {
            if (e.handle() != null) {
                doomedHandles.add(key(e.handle()));
            }
        });

        List<String> blocking = new ArrayList<>();
        for (DxfEntity e : entities.values()) {
            if (doomed.contains(e)) {
                continue;
            }
            for (HandleReference ref : e.references()) {
                if (!ref.kind().isHard() || !doomedHandles.contains(key(ref.handle()))) {
                    continue;
                }
                if (isOwnerOf(e, ref.handle())) {
                    continue;
                }
                if (!blocking.contains(e.handle())) {
                    blocking.add(e.handle());
                }
            }
        }
        if (!blocking.isEmpty()) {
            throw new ProtectedEntityException(entity.handle(), blocking);
        }

        resolve(entity.owner()).ifPresent(owner -> {
            if (owner instanceof EntityContainer container) {
                container.unlink(entity);
            }
        });
        for (DxfEntity e : doomed) {
            if (e.handle() != null) {
                entities.remove(key(e.handle()));
            }
            e.destroy();
        }
        log.debug("删除 {}（连同 {} 个子实体）", entity, doomed.size() - 1);
    }

    private boolean isOwnerOf(DxfEntity owner, String childHandle) {
        return resolve(childHandle)
                .map(child -> owner.handle() != null && owner.handle().equalsIgnoreCase(child.owner()))
                .orElse(false);
    }

    private void collect(DxfEntity entity, Set<DxfEntity> into) {
        if (!into.add(entity)) {
            return;
        }
        entity.subEntities().forEach(sub -> collect(sub, into));
        resolve(entity.xdictionary()).ifPresent(xdict -> collect(xdict, into));
        if (entity instanceof DictionaryObject dict && dict.getInt("hard_owned") == 1) {
            // 硬拥有的字典条目随字典一起删除
            for (String handle : dict.entries().values()) {
                resolve(handle)
                        .filter(child -> entity.handle() != null && entity.handle().equalsIgnoreCase(child.owner()))
                        .ifPresent(child -> collect(child, into));
            }
        }
    }

    private static String key(String handle) {
        return handle.toUpperCase(Locale.ROOT);
    }
}
