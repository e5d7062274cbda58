package com.bit.valorium.genome.impl;

import com.bit.valorium.config.ValoriumProperties;
import com.bit.valorium.crypto.HashChain;
import com.bit.valorium.exception.ErrorType;
import com.bit.valorium.exception.ValoriumException;
import com.bit.valorium.genome.FragmentStore;
import com.bit.valorium.genome.NodeFailureReport;
import com.bit.valorium.genome.RedundancyCodec;
import com.bit.valorium.result.Result;
import com.bit.valorium.structure.genome.FragmentManifest;
import com.bit.valorium.structure.genome.GenomeFragment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.LongAdder;
import java.util.stream.Collectors;

@Slf4j
@Service
public class FragmentStoreImpl implements FragmentStore {

    private final HashChain hashChain;

    private final RedundancyCodec codec;

    private final int redundancy;

    // baseId -> 清单
    private final Map<String, FragmentManifest> manifests = new LinkedHashMap<>();

    // baseId -> 组内片段ID（主片段在前）
    private final Map<String, List<String>> groups = new HashMap<>();

    // 片段ID -> 托管节点
    private final Map<String, Set<String>> locations = new HashMap<>();

    // 节点 -> (片段ID -> 片段)，模拟各托管节点的本地存储
    private final Map<String, Map<String, GenomeFragment>> custodianStorage = new HashMap<>();

    private final Set<String> custodians = new LinkedHashSet<>();

    private final Set<String> failedNodes = new HashSet<>();

    // 已确认不可恢复的片段
    private final Set<String> lostFragments = new TreeSet<>();

    /** 再生成功次数 */
    private final LongAdder regenerationCount = new LongAdder();

    public FragmentStoreImpl(HashChain hashChain, RedundancyCodec codec, ValoriumProperties properties) {
        this.hashChain = hashChain;
        this.codec = codec;
        this.redundancy = properties.getGenome().getRedundancy();
    }

    @Override
    public GenomeFragment createPrimary(String baseId, byte[] payload) {
        return GenomeFragment.builder()
                .fragmentId(GenomeFragment.idOf(baseId, GenomeFragment.PRIMARY_INDEX))
                .baseId(baseId)
                .index(GenomeFragment.PRIMARY_INDEX)
                .payload(payload.clone())
                .checksum(checksumOf(payload))
                .redundancy(redundancy)
                .build();
    }

    @Override
    public synchronized void distribute(GenomeFragment fragment, List<String> targetNodeIds) {
        if (targetNodeIds == null || targetNodeIds.size() < 2) {
            throw new ValoriumException(ErrorType.VALIDATION,
                    "片段 " + fragment.getBaseId() + " 至少需要2个托管节点才能冗余存储");
        }
        if (!fragment.isPrimary()) {
            throw new ValoriumException(ErrorType.VALIDATION, "只能分发主片段: " + fragment.getFragmentId());
        }
        if (!checksumOf(fragment.getPayload()).equals(fragment.getChecksum())) {
            throw new ValoriumException(ErrorType.VALIDATION, "片段校验和与载荷不符: " + fragment.getFragmentId());
        }
        String baseId = fragment.getBaseId();
        if (manifests.containsKey(baseId)) {
            log.debug("片段组{}已分发，忽略重复分发", baseId);
            return;
        }
        // 先筛掉故障节点，校验通过前不改动任何状态
        List<String> targets = targetNodeIds.stream()
                .distinct()
                .filter(nodeId -> !failedNodes.contains(nodeId))
                .collect(Collectors.toList());
        if (targets.size() < targetNodeIds.size()) {
            log.warn("片段组{}的目标中有故障或重复节点，已跳过: {} -> {}", baseId, targetNodeIds, targets);
        }
        if (targets.size() < 2) {
            throw new ValoriumException(ErrorType.VALIDATION,
                    "片段 " + baseId + " 可用托管节点不足2个: " + targets);
        }
        int k = fragment.getRedundancy();
        manifests.put(baseId, new FragmentManifest(baseId, fragment.getPayload().length, fragment.getChecksum(), k));
        List<String> members = new ArrayList<>();
        members.add(fragment.getFragmentId());
        place(fragment, targets.get(0));
        for (int i = 0; i < k; i++) {
            GenomeFragment sibling = deriveSibling(fragment.getPayload(), baseId, i, fragment.getChecksum(), k);
            members.add(sibling.getFragmentId());
            if (i + 1 < targets.size()) {
                place(sibling, targets.get(i + 1));
            } else {
                log.warn("片段{}没有可用托管节点，未放置", sibling.getFragmentId());
            }
        }
        groups.put(baseId, members);
        log.info("片段组{}已分发: {}字节, 冗余因子{}, 托管节点{}", baseId, fragment.getPayload().length, k,
                targets.subList(0, Math.min(targets.size(), k + 1)));
    }

    @Override
    public synchronized NodeFailureReport onNodeFailure(Collection<String> nodeIds) {
        List<String> failed = new ArrayList<>();
        Set<String> orphaned = new LinkedHashSet<>();
        for (String nodeId : nodeIds) {
            if (!failedNodes.add(nodeId)) {
                continue;
            }
            failed.add(nodeId);
            custodians.remove(nodeId);
            Map<String, GenomeFragment> stored = custodianStorage.remove(nodeId);
            if (stored == null) {
                continue;
            }
            for (String fragmentId : stored.keySet()) {
                Set<String> where = locations.get(fragmentId);
                where.remove(nodeId);
                if (where.isEmpty()) {
                    orphaned.add(fragmentId);
                }
            }
        }
        log.warn("节点故障: {}，失去全部位置的片段{}个", failed, orphaned.size());
        List<String> regenerated = new ArrayList<>();
        List<String> lost = new ArrayList<>();
        for (String fragmentId : orphaned) {
            Result<String> result = regenerate(fragmentId);
            if (result.isSuccess()) {
                regenerated.add(fragmentId);
            } else {
                lost.add(fragmentId);
            }
        }
        return new NodeFailureReport(failed, regenerated, lost);
    }

    @Override
    public synchronized Result<String> regenerate(String fragmentId) {
        Set<String> where = locations.get(fragmentId);
        if (where == null) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "未知片段: " + fragmentId);
        }
        if (!where.isEmpty()) {
            return Result.OK("片段仍有存活副本，无需再生", where.iterator().next());
        }
        String baseId = baseIdOf(fragmentId);
        FragmentManifest manifest = manifests.get(baseId);
        Optional<byte[]> original = decodeFromSurvivors(baseId);
        if (original.isEmpty()) {
            if (lostFragments.add(fragmentId)) {
                log.error("片段{}不可恢复: 同组{}没有存活副本", fragmentId, baseId);
            }
            return Result.error(ErrorType.IRRECOVERABLE_FRAGMENT_LOSS, "片段 " + fragmentId + " 无存活冗余副本");
        }
        int index = indexOf(fragmentId);
        GenomeFragment rebuilt = index == GenomeFragment.PRIMARY_INDEX
                ? createPrimary(baseId, original.get()).toBuilder().redundancy(manifest.getRedundancy()).build()
                : deriveSibling(original.get(), baseId, index, manifest.getChecksum(), manifest.getRedundancy());
        Optional<String> target = chooseTarget(baseId);
        if (target.isEmpty()) {
            if (lostFragments.add(fragmentId)) {
                log.error("片段{}已解码但没有存活的托管节点可放置", fragmentId);
            }
            return Result.error(ErrorType.IRRECOVERABLE_FRAGMENT_LOSS, "片段 " + fragmentId + " 没有可用托管节点");
        }
        place(rebuilt, target.get());
        lostFragments.remove(fragmentId);
        regenerationCount.increment();
        log.info("片段{}已再生并放置到节点{}", fragmentId, target.get());
        return Result.OK("片段已再生", target.get());
    }

    @Override
    public synchronized Result<byte[]> reconstruct(String baseId) {
        if (!manifests.containsKey(baseId)) {
            return Result.error(Result.SC_VALIDATION_ERROR_400, "未知片段组: " + baseId);
        }
        return decodeFromSurvivors(baseId)
                .map(Result::OK)
                .orElseGet(() -> Result.error(ErrorType.IRRECOVERABLE_FRAGMENT_LOSS, "片段组 " + baseId + " 无存活副本"));
    }

    /**
     * 依次尝试组内存活片段，解码后用清单校验和确认
     */
    private Optional<byte[]> decodeFromSurvivors(String baseId) {
        FragmentManifest manifest = manifests.get(baseId);
        for (String memberId : groups.getOrDefault(baseId, Collections.emptyList())) {
            for (String nodeId : locations.getOrDefault(memberId, Collections.emptySet())) {
                GenomeFragment stored = custodianStorage.get(nodeId).get(memberId);
                byte[] decoded = stored.isPrimary()
                        ? stored.getPayload()
                        : codec.decode(stored.getPayload(), baseId, stored.getIndex());
                if (decoded.length == manifest.getLength() && checksumOf(decoded).equals(manifest.getChecksum())) {
                    return Optional.of(decoded.clone());
                }
                log.warn("节点{}上的片段{}解码后校验失败", nodeId, memberId);
            }
        }
        return Optional.empty();
    }

    /**
     * 优先选择不持有同组片段的存活节点，其次选择持有片段最少的存活节点
     */
    private Optional<String> chooseTarget(String baseId) {
        Set<String> holders = new HashSet<>();
        for (String memberId : groups.getOrDefault(baseId, Collections.emptyList())) {
            holders.addAll(locations.getOrDefault(memberId, Collections.emptySet()));
        }
        Optional<String> fresh = custodians.stream().filter(id -> !holders.contains(id)).findFirst();
        if (fresh.isPresent()) {
            return fresh;
        }
        return custodians.stream()
                .min(Comparator.comparingInt(id -> custodianStorage.getOrDefault(id, Collections.emptyMap()).size()));
    }

    private GenomeFragment deriveSibling(byte[] original, String baseId, int index, String checksum, int k) {
        return GenomeFragment.builder()
                .fragmentId(GenomeFragment.idOf(baseId, index))
                .baseId(baseId)
                .index(index)
                .payload(codec.encode(original, baseId, index))
                .checksum(checksum)
                .redundancy(k)
                .build();
    }

    private void place(GenomeFragment fragment, String nodeId) {
        if (failedNodes.contains(nodeId)) {
            throw new ValoriumException(ErrorType.VALIDATION, "节点 " + nodeId + " 已故障，不能托管片段");
        }
        custodians.add(nodeId);
        custodianStorage.computeIfAbsent(nodeId, id -> new HashMap<>()).put(fragment.getFragmentId(), fragment);
        locations.computeIfAbsent(fragment.getFragmentId(), id -> new LinkedHashSet<>()).add(nodeId);
    }

    private String baseIdOf(String fragmentId) {
        for (Map.Entry<String, List<String>> group : groups.entrySet()) {
            if (group.getValue().contains(fragmentId)) {
                return group.getKey();
            }
        }
        return GenomeFragment.baseIdOf(fragmentId);
    }

    private int indexOf(String fragmentId) {
        List<String> members = groups.get(baseIdOf(fragmentId));
        // 组内顺序：主片段, r0, r1, ...
        return members.indexOf(fragmentId) - 1;
    }

    private String checksumOf(byte[] payload) {
        return hashChain.digestBytes(payload).toHex();
    }

    @Override
    public synchronized void registerCustodian(String nodeId) {
        if (!failedNodes.contains(nodeId)) {
            custodians.add(nodeId);
        }
    }

    @Override
    public synchronized boolean isFailed(String nodeId) {
        return failedNodes.contains(nodeId);
    }

    @Override
    public synchronized Set<String> locationsOf(String fragmentId) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(locations.getOrDefault(fragmentId, Collections.emptySet())));
    }

    @Override
    public synchronized int tolerableFailures(String baseId) {
        Set<String> holders = new HashSet<>();
        for (String memberId : groups.getOrDefault(baseId, Collections.emptyList())) {
            holders.addAll(locations.getOrDefault(memberId, Collections.emptySet()));
        }
        return Math.max(0, holders.size() - 1);
    }

    @Override
    public synchronized boolean contains(String baseId) {
        return manifests.containsKey(baseId);
    }

    @Override
    public long getRegenerationCount() {
        return regenerationCount.sum();
    }

    @Override
    public synchronized long getIrrecoverableLossCount() {
        return lostFragments.size();
    }
}
