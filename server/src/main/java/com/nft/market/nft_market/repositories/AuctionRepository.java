package com.nft.market.nft_market.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.Auction;

@Repository
public interface AuctionRepository extends MongoRepository<Auction, Long> {
    List<Auction> findBySellerOrderByIdDesc(String seller);
}
